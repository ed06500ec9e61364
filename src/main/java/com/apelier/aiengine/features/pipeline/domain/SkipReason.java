package com.apelier.aiengine.features.pipeline.domain;

/**
 * Why a phase did not process a photo, or did not run at all.
 */
public enum SkipReason {
    DOWNLOAD_FAILED,
    DECODE_FAILED,
    UPLOAD_FAILED,
    NO_FACES,
    GPU_UNAVAILABLE,
    NO_STYLE_MODEL,
    GPU_CALL_FAILED,
    GPU_BATCH_FAILED,
    UNEXPECTED_ERROR
}
