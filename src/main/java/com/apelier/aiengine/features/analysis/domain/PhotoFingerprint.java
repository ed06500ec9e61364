package com.apelier.aiengine.features.analysis.domain;

/**
 * A photo's perceptual hash, input to duplicate grouping. The hash may be null for photos that were not analysed.
 */
public record PhotoFingerprint(String photoId, String perceptualHash) {
    
    public boolean isHashed() {
        return perceptualHash != null && !perceptualHash.isEmpty();
    }
}
