package com.apelier.aiengine.features.storage.infra;

import com.apelier.aiengine.features.storage.domain.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.util.Optional;

@Component
public class S3ObjectStore implements ObjectStore {
    
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);
    
    private final S3Client s3Client;
    
    public S3ObjectStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }
    
    @Override
    public Optional<byte[]> download(String bucket, String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            return Optional.of(response.readAllBytes());
        } catch (NoSuchKeyException e) {
            log.warn("Object not found: bucket={}, key={}", bucket, key);
            return Optional.empty();
        } catch (SdkException | IOException e) {
            log.warn("Failed to download object: bucket={}, key={}, error={}", bucket, key, e.getMessage());
            return Optional.empty();
        }
    }
    
    @Override
    public boolean upload(String bucket, String key, byte[] data, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) data.length)
                .build();
        
        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(data));
            log.debug("Uploaded object: bucket={}, key={}, bytes={}", bucket, key, data.length);
            return true;
        } catch (SdkException e) {
            log.error("Failed to upload object: bucket={}, key={}", bucket, key, e);
            return false;
        }
    }
}
