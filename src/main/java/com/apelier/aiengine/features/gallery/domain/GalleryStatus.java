package com.apelier.aiengine.features.gallery.domain;

/**
 * Gallery, shoot job and photo status values this service writes. The vocabularies belong to the web
 * application, so they stay plain strings.
 */
public final class GalleryStatus {
    
    public static final String GALLERY_PROCESSING = "processing";
    public static final String GALLERY_READY = "ready";
    public static final String JOB_READY_FOR_REVIEW = "ready_for_review";
    public static final String PHOTO_UPLOADED = "uploaded";
    public static final String PHOTO_EDITED = "edited";
    
    private GalleryStatus() {
    }
}
