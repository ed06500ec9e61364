package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.features.analysis.app.ImageDecoder;
import com.apelier.aiengine.features.composition.app.CompositionAdjuster;
import com.apelier.aiengine.features.composition.domain.CompositionResult;
import com.apelier.aiengine.features.composition.domain.CropRect;
import com.apelier.aiengine.features.gallery.domain.AiEdits;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import com.apelier.aiengine.features.storage.domain.ObjectStore;
import com.apelier.aiengine.features.storage.domain.StorageKeys;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Levels horizons on the latest version of each photo. A corrected image is re-encoded to the edited key;
 * either way the photo records that composition was evaluated, and the resulting image is kept for the output phase.
 */
@Component
public class CompositionPhaseHandler extends PerPhotoPhaseHandler {
    
    private final ObjectStore objectStore;
    private final ImageDecoder imageDecoder;
    private final CompositionAdjuster compositionAdjuster;
    private final PhotoRepository photoRepository;
    private final String bucket;
    private final int jpegQuality;
    
    public CompositionPhaseHandler(
            ObjectStore objectStore,
            ImageDecoder imageDecoder,
            CompositionAdjuster compositionAdjuster,
            PhotoRepository photoRepository,
            PipelineProperties properties) {
        this.objectStore = objectStore;
        this.imageDecoder = imageDecoder;
        this.compositionAdjuster = compositionAdjuster;
        this.photoRepository = photoRepository;
        this.bucket = properties.getStorageBucket();
        this.jpegQuality = properties.getCompositionJpegQuality();
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.COMPOSITION;
    }
    
    @Override
    protected StepOutcome process(PipelineRun run, Photo photo) {
        String sourceKey = photo.getEditedKey() != null ? photo.getEditedKey() : photo.getOriginalKey();
        Optional<byte[]> source = photo.getEditedKey() == null
                ? run.workingSet().original(photo.getId()).or(() -> objectStore.download(bucket, sourceKey))
                : objectStore.download(bucket, sourceKey);
        if (source.isEmpty()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.DOWNLOAD_FAILED, sourceKey);
        }
        
        Optional<Mat> decoded = imageDecoder.decode(source.get());
        if (decoded.isEmpty()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.DECODE_FAILED, sourceKey);
        }
        
        CompositionResult result;
        try {
            result = compositionAdjuster.adjust(decoded.get(), photo.faceBoxes());
        } finally {
            decoded.get().release();
        }
        
        if (!result.changed()) {
            photo.recordComposition(null, AiEdits.Composition.noChanges());
            photoRepository.save(photo);
            run.workingSet().putProcessed(photo.getId(), result.image());
            return StepOutcome.unchanged(photo.getId());
        }
        
        String outputKey = StorageKeys.forceJpegExtension(
                photo.getEditedKey() != null ? photo.getEditedKey() : StorageKeys.editedKeyFor(photo.getOriginalKey()));
        byte[] encoded = ImageMats.encodeJpeg(result.image(), jpegQuality);
        if (!objectStore.upload(bucket, outputKey, encoded, StorageKeys.JPEG_CONTENT_TYPE)) {
            result.image().release();
            return StepOutcome.skipped(photo.getId(), SkipReason.UPLOAD_FAILED, outputKey);
        }
        
        photo.recordComposition(outputKey, AiEdits.Composition.applied(
                result.straightened() ? result.horizonAngle() : null,
                result.cropped() ? toList(result.cropRect()) : null));
        photoRepository.save(photo);
        run.workingSet().putProcessed(photo.getId(), result.image());
        return StepOutcome.applied(photo.getId());
    }
    
    private static List<Integer> toList(CropRect rect) {
        return List.of(rect.x(), rect.y(), rect.width(), rect.height());
    }
}
