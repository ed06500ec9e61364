package com.apelier.aiengine.features.pipeline.domain;

import com.apelier.aiengine.features.gallery.domain.PipelinePhase;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public record PipelineRunReport(
    String galleryId,
    int totalPhotos,
    boolean gpuEnabled,
    List<PhaseReport> phases,
    Duration elapsed
) {
    
    public PipelineRunReport {
        phases = List.copyOf(phases);
    }
    
    public Optional<PhaseReport> phase(PipelinePhase phase) {
        return phases.stream().filter(report -> report.phase() == phase).findFirst();
    }
    
    public double secondsPerPhoto() {
        return elapsed.toMillis() / 1000.0 / Math.max(1, totalPhotos);
    }
}
