package com.apelier.aiengine.features.pipeline.domain;

public enum StepStatus {
    /** The phase changed the photo. */
    APPLIED,
    /** The phase looked at the photo and found nothing to change. */
    UNCHANGED,
    SKIPPED
}
