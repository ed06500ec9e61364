package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.gallery.domain.ProcessingJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Writes a run's progress to its processing job record. A failed write is logged and does not stop the run.
 */
public class PhaseProgressTracker {
    
    private static final Logger log = LoggerFactory.getLogger(PhaseProgressTracker.class);
    
    private final ProcessingJobRepository repository;
    private final String processingJobId;
    private ProcessingJob job;
    
    public PhaseProgressTracker(ProcessingJobRepository repository, String processingJobId) {
        this.repository = repository;
        this.processingJobId = processingJobId;
    }
    
    public void enterPhase(PipelinePhase phase, int totalImages) {
        update(job -> job.enterPhase(phase, totalImages));
    }
    
    public void advance(int processedImages) {
        update(job -> job.recordProgress(processedImages));
    }
    
    public void completePhase() {
        update(ProcessingJob::completePhase);
    }
    
    public void markCompleted() {
        update(ProcessingJob::markCompleted);
    }
    
    public void markFailed(String error) {
        update(job -> job.markFailed(error));
    }
    
    private void update(Consumer<ProcessingJob> change) {
        try {
            if (job == null) {
                job = repository.findById(processingJobId).orElse(null);
                if (job == null) {
                    log.warn("Processing job {} not found, progress not recorded", processingJobId);
                    return;
                }
            }
            change.accept(job);
            job = repository.save(job);
        } catch (RuntimeException e) {
            log.warn("Failed to update progress of processing job {}: {}", processingJobId, e.getMessage());
            // Re-read on the next write so a rejected save does not leave stale state behind
            job = null;
        }
    }
}
