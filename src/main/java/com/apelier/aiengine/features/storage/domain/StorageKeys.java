package com.apelier.aiengine.features.storage.domain;

/**
 * Object-store key layout for pipeline outputs.
 */
public final class StorageKeys {
    
    public static final String JPEG_CONTENT_TYPE = "image/jpeg";
    
    private StorageKeys() {
    }
    
    /**
     * Edited key for an original: {@code uploads/} becomes {@code edited/} and the extension is forced to {@code .jpg}.
     */
    public static String editedKeyFor(String originalKey) {
        return forceJpegExtension(originalKey.replace("uploads/", "edited/"));
    }
    
    public static String forceJpegExtension(String key) {
        String lower = key.toLowerCase();
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return key;
        }
        int lastSlash = key.lastIndexOf('/');
        int lastDot = key.lastIndexOf('.');
        String base = lastDot > lastSlash ? key.substring(0, lastDot) : key;
        return base + ".jpg";
    }
    
    /**
     * Keys of the three delivery tiers: {@code {photographer}/{gallery}/{edited|web|thumb}/{stem}.jpg}.
     */
    public static OutputKeys outputKeys(String photographerId, String galleryId, String filename) {
        String stem = stem(filename);
        String prefix = photographerId + "/" + galleryId + "/";
        return new OutputKeys(
            prefix + "edited/" + stem + ".jpg",
            prefix + "web/" + stem + ".jpg",
            prefix + "thumb/" + stem + ".jpg"
        );
    }
    
    static String stem(String filename) {
        String name = filename.substring(filename.lastIndexOf('/') + 1);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }
    
    public record OutputKeys(String editedKey, String webKey, String thumbKey) {
    }
}
