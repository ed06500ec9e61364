package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.features.analysis.app.AnalysisEngine;
import com.apelier.aiengine.features.analysis.app.DuplicateGrouper;
import com.apelier.aiengine.features.analysis.domain.AnalysisOutcome;
import com.apelier.aiengine.features.analysis.domain.AnalysisResult;
import com.apelier.aiengine.features.analysis.domain.PhotoFingerprint;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.pipeline.domain.PhaseReport;
import com.apelier.aiengine.features.pipeline.domain.SkipReason;
import com.apelier.aiengine.features.pipeline.domain.StepOutcome;
import com.apelier.aiengine.features.storage.domain.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads each original, analyses it and writes scene, quality, faces, EXIF and dimensions to the photo.
 * Original bytes and analysis results stay in the run's working set for later phases.
 */
@Component
public class AnalysisPhaseHandler extends PerPhotoPhaseHandler {
    
    private static final Logger log = LoggerFactory.getLogger(AnalysisPhaseHandler.class);
    
    private final ObjectStore objectStore;
    private final AnalysisEngine analysisEngine;
    private final DuplicateGrouper duplicateGrouper;
    private final PhotoRepository photoRepository;
    private final String bucket;
    
    public AnalysisPhaseHandler(
            ObjectStore objectStore,
            AnalysisEngine analysisEngine,
            DuplicateGrouper duplicateGrouper,
            PhotoRepository photoRepository,
            PipelineProperties properties) {
        this.objectStore = objectStore;
        this.analysisEngine = analysisEngine;
        this.duplicateGrouper = duplicateGrouper;
        this.photoRepository = photoRepository;
        this.bucket = properties.getStorageBucket();
    }
    
    @Override
    public PipelinePhase phase() {
        return PipelinePhase.ANALYSIS;
    }
    
    @Override
    public PhaseReport execute(PipelineRun run) {
        PhaseReport report = super.execute(run);
        logDuplicateGroups(run);
        return report;
    }
    
    @Override
    protected StepOutcome process(PipelineRun run, Photo photo) {
        Optional<byte[]> original = objectStore.download(bucket, photo.getOriginalKey());
        if (original.isEmpty()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.DOWNLOAD_FAILED, photo.getOriginalKey());
        }
        run.workingSet().putOriginal(photo.getId(), original.get());
        
        AnalysisOutcome outcome = analysisEngine.analyse(original.get());
        if (outcome.result().isEmpty()) {
            return StepOutcome.skipped(photo.getId(), SkipReason.DECODE_FAILED, outcome.error());
        }
        AnalysisResult result = outcome.result().get();
        
        photo.applyAnalysis(result);
        photoRepository.save(photo);
        run.workingSet().putAnalysis(photo.getId(), result);
        
        log.debug("Analysed photo {}: scene={}, quality={}, faces={}",
                photo.getId(), result.sceneType().value(), result.qualityScore(), result.faceCount());
        return StepOutcome.applied(photo.getId());
    }
    
    private void logDuplicateGroups(PipelineRun run) {
        List<PhotoFingerprint> fingerprints = run.photos().stream()
                .map(photo -> new PhotoFingerprint(photo.getId(),
                        run.workingSet().analysis(photo.getId()).map(AnalysisResult::perceptualHash).orElse(null)))
                .toList();
        Map<String, List<String>> groups = duplicateGrouper.group(fingerprints);
        long bursts = groups.values().stream().filter(members -> members.size() > 1).count();
        if (bursts > 0) {
            log.info("Gallery {}: {} photos in {} groups, {} with near-duplicates",
                    run.galleryId(), fingerprints.size(), groups.size(), bursts);
        }
    }
}
