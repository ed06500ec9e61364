package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gpu.domain.GpuCallStatus;
import com.apelier.aiengine.features.gpu.domain.StyleBatchItem;
import com.apelier.aiengine.features.gpu.domain.StyleBatchResult;
import com.apelier.aiengine.features.pipeline.domain.PhaseReport;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import com.apelier.aiengine.features.storage.domain.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Applies the photographer's trained style model on the GPU service in fixed-size batches.
 * The first failed batch stops the phase; photos not yet styled continue unstyled.
 */
@Component
public class StylePhaseHandler implements PipelinePhaseHandler {
    
    private static final Logger log = LoggerFactory.getLogger(StylePhaseHandler.class);
    
    private final PhotoRepository photoRepository;
    private final int batchSize;
    private final int jpegQuality;
    
    public StylePhaseHandler(PhotoRepository photoRepository, PipelineProperties properties) {
        if (properties.getStyleBatchSize() < 1) {
            throw new IllegalArgumentException("Style batch size must be positive");
        }
        this.photoRepository = photoRepository;
        this.batchSize = properties.getStyleBatchSize();
        this.jpegQuality = properties.getStyleJpegQuality();
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.STYLE;
    }
    
    @Override
    public PhaseReport execute(PipelineRun run) {
        List<String> photoIds = run.photos().stream().map(Photo::getId).toList();
        if (!run.isGpuAvailable()) {
            log.info("Phase style: skipped (no GPU)");
            return PhaseReport.skipped(phase(), SkipReason.GPU_UNAVAILABLE, photoIds);
        }
        if (!run.hasStyle()) {
            log.info("Phase style: skipped (no trained model)");
            return PhaseReport.skipped(phase(), SkipReason.NO_STYLE_MODEL, photoIds);
        }
        
        String modelFilename = run.modelFilename().orElseThrow();
        List<Photo> photos = run.photos();
        List<StepOutcome> outcomes = new ArrayList<>();
        log.info("Phase style: applying {} to {} photos", modelFilename, photos.size());
        
        int processed = 0;
        for (int start = 0; start < photos.size(); start += batchSize) {
            List<Photo> batch = photos.subList(start, Math.min(start + batchSize, photos.size()));
            List<StyleBatchItem> items = batch.stream()
                    .map(photo -> new StyleBatchItem(photo.getOriginalKey(), StorageKeys.editedKeyFor(photo.getOriginalKey())))
                    .toList();
            
            StyleBatchResult result = run.gpu().applyStyleBatch(items, modelFilename, jpegQuality);
            if (result.isError()) {
                log.error("GPU style batch failed: {}", result.message());
                for (Photo photo : photos.subList(start, photos.size())) {
                    outcomes.add(StepOutcome.skipped(photo.getId(), SkipReason.GPU_BATCH_FAILED, result.message()));
                }
                break;
            }
            
            Map<String, String> itemStatus = itemStatuses(result);
            for (int i = 0; i < batch.size(); i++) {
                outcomes.add(recordStyled(batch.get(i), items.get(i), itemStatus));
            }
            processed += batch.size();
            run.progress().advance(processed);
        }
        return PhaseReport.of(phase(), outcomes);
    }
    
    private StepOutcome recordStyled(Photo photo, StyleBatchItem item, Map<String, String> itemStatus) {
        if (GpuCallStatus.ERROR.equals(itemStatus.get(item.imageKey()))) {
            return StepOutcome.skipped(photo.getId(), SkipReason.GPU_CALL_FAILED, "style failed for " + item.imageKey());
        }
        try {
            photo.markStyled(item.outputKey());
            photoRepository.save(photo);
            return StepOutcome.applied(photo.getId());
        } catch (RuntimeException e) {
            log.error("Failed to record style for photo {}", photo.getId(), e);
            return StepOutcome.skipped(photo.getId(), SkipReason.UNEXPECTED_ERROR, e.getMessage());
        }
    }
    
    private static Map<String, String> itemStatuses(StyleBatchResult result) {
        if (result.results() == null) {
            return Map.of();
        }
        return result.results().stream()
                .filter(item -> item.imageKey() != null && item.status() != null)
                .collect(Collectors.toMap(StyleBatchItem::imageKey, StyleBatchItem::status, (a, b) -> b));
    }
}
