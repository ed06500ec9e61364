package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.features.gallery.domain.DetectedFace;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gpu.domain.FaceRetouchResult;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Face retouch on the GPU service for photos with at least one detected face.
 * Runs whenever the GPU is available, whether or not the style phase ran.
 */
@Component
public class RetouchPhaseHandler extends PerPhotoPhaseHandler {
    
    private final PhotoRepository photoRepository;
    private final double fidelity;
    
    public RetouchPhaseHandler(PhotoRepository photoRepository, PipelineProperties properties) {
        this.photoRepository = photoRepository;
        this.fidelity = properties.getRetouchFidelity();
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.RETOUCH;
    }
    
    @Override
    protected Optional<SkipReason> skipReason(PipelineRun run) {
        return run.isGpuAvailable() ? Optional.empty() : Optional.of(SkipReason.GPU_UNAVAILABLE);
    }
    
    @Override
    protected StepOutcome process(PipelineRun run, Photo photo) {
        List<DetectedFace> faces = photo.getFaceData();
        if (faces == null || faces.isEmpty()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.NO_FACES);
        }
        
        GpuTarget target = GpuTarget.of(photo);
        FaceRetouchResult result = run.gpu().faceRetouch(target.imageKey(), target.outputKey(), fidelity, faces);
        if (!result.isSuccess()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.GPU_CALL_FAILED, result.message());
        }
        
        photo.recordFaceRetouch(target.outputKey(), result.facesFound(), fidelity);
        photoRepository.save(photo);
        return StepOutcome.applied(photo.getId());
    }
}
