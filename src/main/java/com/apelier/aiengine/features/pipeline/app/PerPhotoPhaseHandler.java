package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.pipeline.domain.PhaseReport;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Phase that visits the run's photos one at a time, isolating each photo's failure from the rest.
 */
public abstract class PerPhotoPhaseHandler implements PipelinePhaseHandler {
    
    private final Logger log = LoggerFactory.getLogger(getClass());
    
    @Override
    public PhaseReport execute(PipelineRun run) {
        Optional<SkipReason> phaseSkip = skipReason(run);
        if (phaseSkip.isPresent()) {
            log.info("Phase {}: skipped ({})", phase().value(), phaseSkip.get());
            return PhaseReport.skipped(phase(), phaseSkip.get(), run.photos().stream().map(Photo::getId).toList());
        }
        
        List<StepOutcome> outcomes = new ArrayList<>();
        List<Photo> photos = run.photos();
        for (int i = 0; i < photos.size(); i++) {
            Photo photo = photos.get(i);
            StepOutcome outcome;
            try {
                outcome = process(run, photo);
            } catch (RuntimeException e) {
                log.error("Phase {} failed for photo {}", phase().value(), photo.getId(), e);
                outcome = StepOutcome.skipped(photo.getId(), SkipReason.UNEXPECTED_ERROR, e.getMessage());
            }
            if (outcome.isSkipped()) {
                log.warn("Phase {}: skipped photo {} ({}{})", phase().value(), photo.getId(), outcome.skipReason(),
                        outcome.detail() != null ? ": " + outcome.detail() : "");
            }
            outcomes.add(outcome);
            run.progress().advance(i + 1);
        }
        return PhaseReport.of(phase(), outcomes);
    }
    
    /**
     * Reason the whole phase is a no-op for this run, if any.
     */
    protected Optional<SkipReason> skipReason(PipelineRun run) {
        return Optional.empty();
    }
    
    protected abstract StepOutcome process(PipelineRun run, Photo photo);
}
