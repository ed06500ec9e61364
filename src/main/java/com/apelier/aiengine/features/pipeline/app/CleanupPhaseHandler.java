package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gpu.domain.SceneCleanupResult;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Removes distracting objects (power lines, exit signs) on the GPU service.
 */
@Component
public class CleanupPhaseHandler extends PerPhotoPhaseHandler {
    
    static final List<String> DETECTIONS = List.of("power_lines", "exit_signs");
    
    private final PhotoRepository photoRepository;
    
    public CleanupPhaseHandler(PhotoRepository photoRepository) {
        this.photoRepository = photoRepository;
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.CLEANUP;
    }
    
    @Override
    protected Optional<SkipReason> skipReason(PipelineRun run) {
        return run.isGpuAvailable() ? Optional.empty() : Optional.of(SkipReason.GPU_UNAVAILABLE);
    }
    
    @Override
    protected StepOutcome process(PipelineRun run, Photo photo) {
        GpuTarget target = GpuTarget.of(photo);
        SceneCleanupResult result = run.gpu().sceneCleanup(target.imageKey(), target.outputKey(), DETECTIONS);
        if (!result.isSuccess()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.GPU_CALL_FAILED, result.message());
        }
        if (result.detectionsFound() <= 0) {
            return StepOutcome.unchanged(photo.getId());
        }
        
        photo.recordSceneCleanup(target.outputKey(), result.detectionsFound(), result.maskCoveragePct());
        photoRepository.save(photo);
        return StepOutcome.applied(photo.getId());
    }
}
