package com.apelier.aiengine.features.gallery.domain;

import java.util.Optional;

public interface ProcessingJobRepository {
    ProcessingJob save(ProcessingJob job);
    Optional<ProcessingJob> findById(String id);
}
