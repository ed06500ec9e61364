package com.apelier.aiengine.features.pipeline.domain;

import com.apelier.aiengine.features.gallery.domain.PipelinePhase;

import java.util.List;

/**
 * Per-photo outcomes of one phase. {@code phaseSkipReason} is set when the whole phase was a no-op,
 * in which case every photo carries the same skip reason.
 */
public record PhaseReport(PipelinePhase phase, List<StepOutcome> outcomes, SkipReason phaseSkipReason) {
    
    public PhaseReport {
        outcomes = List.copyOf(outcomes);
    }
    
    public static PhaseReport of(PipelinePhase phase, List<StepOutcome> outcomes) {
        return new PhaseReport(phase, outcomes, null);
    }
    
    public static PhaseReport skipped(PipelinePhase phase, SkipReason reason, List<String> photoIds) {
        return new PhaseReport(phase,
                photoIds.stream().map(id -> StepOutcome.skipped(id, reason)).toList(),
                reason);
    }
    
    public boolean isPhaseSkipped() {
        return phaseSkipReason != null;
    }
    
    public long count(StepStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }
    
    public StepOutcome outcomeFor(String photoId) {
        return outcomes.stream()
                .filter(outcome -> outcome.photoId().equals(photoId))
                .findFirst()
                .orElse(null);
    }
    
    public String summary() {
        if (isPhaseSkipped()) {
            return phase.value() + ": skipped (" + phaseSkipReason + ")";
        }
        return phase.value() + ": applied=" + count(StepStatus.APPLIED)
                + ", unchanged=" + count(StepStatus.UNCHANGED)
                + ", skipped=" + count(StepStatus.SKIPPED);
    }
}
