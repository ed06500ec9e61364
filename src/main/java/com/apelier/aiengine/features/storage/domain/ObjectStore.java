package com.apelier.aiengine.features.storage.domain;

import java.util.Optional;

/**
 * Binary blob storage. Failures are reported through the return value, never thrown.
 */
public interface ObjectStore {
    
    Optional<byte[]> download(String bucket, String key);
    
    boolean upload(String bucket, String key, byte[] data, String contentType);
}
