package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.features.analysis.app.ImageDecoder;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.output.app.OutputGenerator;
import com.apelier.aiengine.features.output.domain.GeneratedOutputs;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import com.apelier.aiengine.features.storage.domain.ObjectStore;
import com.apelier.aiengine.features.storage.domain.StorageKeys;
import org.opencv.core.Mat;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Encodes and uploads the web and thumbnail tiers of each photo, then marks it edited.
 * When no earlier phase produced an edited version, the full-resolution tier is uploaded too and becomes
 * the edited key; an existing edited object is left as written.
 */
@Component
public class OutputPhaseHandler extends PerPhotoPhaseHandler {
    
    public static final String PIPELINE_VERSION = "2.0";
    
    private final ObjectStore objectStore;
    private final ImageDecoder imageDecoder;
    private final OutputGenerator outputGenerator;
    private final EditConfidenceCalculator confidenceCalculator;
    private final PhotoRepository photoRepository;
    private final String bucket;
    
    public OutputPhaseHandler(
            ObjectStore objectStore,
            ImageDecoder imageDecoder,
            OutputGenerator outputGenerator,
            EditConfidenceCalculator confidenceCalculator,
            PhotoRepository photoRepository,
            PipelineProperties properties) {
        this.objectStore = objectStore;
        this.imageDecoder = imageDecoder;
        this.outputGenerator = outputGenerator;
        this.confidenceCalculator = confidenceCalculator;
        this.photoRepository = photoRepository;
        this.bucket = properties.getStorageBucket();
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.OUTPUT;
    }
    
    @Override
    protected StepOutcome process(PipelineRun run, Photo photo) {
        try {
            Optional<Mat> image = run.workingSet().processed(photo.getId());
            if (image.isEmpty()) {
                image = downloadLatest(photo);
                image.ifPresent(mat -> run.workingSet().putProcessed(photo.getId(), mat));
            }
            if (image.isEmpty()) {
                return StepOutcome.skipped(photo.getId(), SkipReason.DOWNLOAD_FAILED, "no image data");
            }
            
            GeneratedOutputs outputs = outputGenerator.generate(image.get());
            StorageKeys.OutputKeys keys = StorageKeys.outputKeys(run.photographerId(), run.galleryId(), fileName(photo));
            boolean hasEditedVersion = photo.getEditedKey() != null;
            String editedKey = hasEditedVersion ? photo.getEditedKey() : keys.editedKey();
            
            // An existing edited object is already final; only unedited photos get the full tier
            if ((!hasEditedVersion && !upload(editedKey, outputs.fullRes()))
                    || !upload(keys.webKey(), outputs.webRes())
                    || !upload(keys.thumbKey(), outputs.thumbnail())) {
                return StepOutcome.skipped(photo.getId(), SkipReason.UPLOAD_FAILED, editedKey);
            }
            
            double confidence = confidenceCalculator.calculate(photo.getQualityScore(), photo.edits());
            photo.markEdited(editedKey, keys.webKey(), keys.thumbKey(), outputs.fullWidth(), outputs.fullHeight(),
                    confidence, PIPELINE_VERSION, run.hasStyle());
            photoRepository.save(photo);
            return StepOutcome.applied(photo.getId());
        } finally {
            run.workingSet().evict(photo.getId());
        }
    }
    
    private Optional<Mat> downloadLatest(Photo photo) {
        String sourceKey = photo.getEditedKey() != null ? photo.getEditedKey() : photo.getOriginalKey();
        return objectStore.download(bucket, sourceKey).flatMap(imageDecoder::decode);
    }
    
    private boolean upload(String key, byte[] data) {
        return objectStore.upload(bucket, key, data, StorageKeys.JPEG_CONTENT_TYPE);
    }
    
    private static String fileName(Photo photo) {
        return photo.getFilename() != null && !photo.getFilename().isBlank()
                ? photo.getFilename()
                : photo.getOriginalKey();
    }
}
