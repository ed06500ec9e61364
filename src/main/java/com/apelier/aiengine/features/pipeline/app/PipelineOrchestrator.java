package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.Gallery;
import com.apelier.aiengine.features.gallery.domain.GalleryRepository;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gallery.domain.ProcessingJobRepository;
import com.apelier.aiengine.features.gallery.domain.ShootJobRepository;
import com.apelier.aiengine.features.gallery.domain.StyleProfile;
import com.apelier.aiengine.features.gallery.domain.StyleProfileRepository;
import com.apelier.aiengine.features.gpu.domain.GpuClient;
import com.apelier.aiengine.features.gpu.domain.GpuClientFactory;
import com.apelier.aiengine.features.gpu.domain.GpuHealth;
import com.apelier.aiengine.features.pipeline.domain.MissingPhotographerException;
import com.apelier.aiengine.features.pipeline.domain.NoPhotosException;
import com.apelier.aiengine.features.pipeline.domain.PhaseReport;
import com.apelier.aiengine.features.pipeline.domain.PipelineException;
import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;
import com.apelier.aiengine.features.pipeline.domain.PipelineRunReport;
import com.apelier.aiengine.features.pipeline.domain.UnhandledPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the six processing phases for one gallery, in order: analysis, style, retouch, cleanup, composition, output.
 * <p>
 * Progress is written to the processing job before and after every phase. A missing photographer or an empty
 * gallery fails the job before any phase starts; any exception escaping a phase fails it with the exception's
 * message. The GPU session and the run's working set are released however the run ends.
 */
@Service
public class PipelineOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    
    private static final Set<PipelinePhase> PROCESSING_PHASES = EnumSet.range(PipelinePhase.ANALYSIS, PipelinePhase.OUTPUT);
    
    private final GalleryRepository galleryRepository;
    private final ShootJobRepository shootJobRepository;
    private final PhotoRepository photoRepository;
    private final ProcessingJobRepository processingJobRepository;
    private final StyleProfileRepository styleProfileRepository;
    private final GpuClientFactory gpuClientFactory;
    private final List<PipelinePhaseHandler> handlers;
    
    public PipelineOrchestrator(
            GalleryRepository galleryRepository,
            ShootJobRepository shootJobRepository,
            PhotoRepository photoRepository,
            ProcessingJobRepository processingJobRepository,
            StyleProfileRepository styleProfileRepository,
            GpuClientFactory gpuClientFactory,
            List<PipelinePhaseHandler> handlers) {
        this.galleryRepository = galleryRepository;
        this.shootJobRepository = shootJobRepository;
        this.photoRepository = photoRepository;
        this.processingJobRepository = processingJobRepository;
        this.styleProfileRepository = styleProfileRepository;
        this.gpuClientFactory = gpuClientFactory;
        this.handlers = handlers.stream()
                .sorted(Comparator.comparing(PipelinePhaseHandler::phase))
                .toList();
        
        Set<PipelinePhase> covered = this.handlers.stream()
                .map(PipelinePhaseHandler::phase)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(PipelinePhase.class)));
        if (!covered.equals(PROCESSING_PHASES) || this.handlers.size() != PROCESSING_PHASES.size()) {
            throw new IllegalStateException("Expected exactly one handler per phase " + PROCESSING_PHASES + ", got " + covered);
        }
    }
    
    /**
     * Run the pipeline for a gallery. Never throws: the outcome is written to the processing job.
     *
     * @return the run report, or empty when the run failed
     */
    public Optional<PipelineRunReport> run(PipelineRequest request) {
        long started = System.nanoTime();
        PhaseProgressTracker progress = new PhaseProgressTracker(processingJobRepository, request.processingJobId());
        
        // Failures opening the GPU session are caught below as well
        try (GpuClient gpu = gpuClientFactory.open();
             RunWorkingSet workingSet = new RunWorkingSet()) {
            PipelineRun run = prepare(request, gpu, workingSet, progress);
            List<PhaseReport> reports = executePhases(run);
            finish(run);
            
            PipelineRunReport report = new PipelineRunReport(request.galleryId(), run.totalPhotos(),
                    run.isGpuAvailable(), reports, Duration.ofNanos(System.nanoTime() - started));
            log.info("Pipeline complete for gallery {}: {} photos in {}s ({}s/photo avg), GPU={}",
                    request.galleryId(), run.totalPhotos(), report.elapsed().toSeconds(),
                    String.format("%.1f", report.secondsPerPhoto()), run.isGpuAvailable() ? "yes" : "no");
            reports.forEach(phase -> log.info("  {}", phase.summary()));
            return Optional.of(report);
        } catch (MissingPhotographerException | NoPhotosException e) {
            log.error("Pipeline for gallery {} not started: {}", request.galleryId(), e.getMessage());
            progress.markFailed(e.getMessage());
        } catch (PipelineException e) {
            log.error("Pipeline failed for gallery {}", request.galleryId(), e);
            progress.markFailed(e.getMessage());
        } catch (RuntimeException e) {
            UnhandledPipelineException failure = new UnhandledPipelineException(e);
            log.error("Pipeline failed for gallery {}", request.galleryId(), failure);
            progress.markFailed(failure.getMessage());
        }
        return Optional.empty();
    }
    
    private PipelineRun prepare(PipelineRequest request, GpuClient gpu, RunWorkingSet workingSet,
                                PhaseProgressTracker progress) {
        String photographerId = request.photographerId();
        String jobId = request.jobId();
        if (photographerId == null || jobId == null) {
            try {
                Optional<Gallery> gallery = galleryRepository.findById(request.galleryId());
                if (gallery.isPresent()) {
                    photographerId = photographerId != null ? photographerId : gallery.get().getPhotographerId();
                    jobId = jobId != null ? jobId : gallery.get().getJobId();
                }
            } catch (RuntimeException e) {
                log.warn("Could not look up gallery {}: {}", request.galleryId(), e.getMessage());
            }
        }
        if (photographerId == null || photographerId.isBlank()) {
            throw new MissingPhotographerException();
        }
        
        boolean gpuAvailable = false;
        if (gpu.isConfigured()) {
            GpuHealth health = gpu.health();
            gpuAvailable = health.isNominal();
            if (gpuAvailable) {
                log.info("GPU endpoints available");
            } else {
                log.warn("GPU unavailable ({}), GPU phases will be skipped", health.status());
            }
        }
        
        String modelFilename = resolveModelFilename(request.styleProfileId());
        
        List<Photo> photos = photoRepository.findByGalleryIdAndCulledFalseOrderBySortOrderAsc(request.galleryId());
        if (photos.isEmpty()) {
            throw new NoPhotosException();
        }
        
        log.info("Starting pipeline for gallery {}: {} photos, GPU={}",
                request.galleryId(), photos.size(), gpuAvailable ? "enabled" : "disabled");
        return new PipelineRun(request, photographerId, jobId, gpu, gpuAvailable, modelFilename,
                photos, workingSet, progress);
    }
    
    private String resolveModelFilename(String styleProfileId) {
        if (styleProfileId == null) {
            return null;
        }
        try {
            Optional<StyleProfile> profile = styleProfileRepository.findById(styleProfileId);
            Optional<String> filename = profile.flatMap(StyleProfile::modelFilename);
            if (filename.isPresent()) {
                log.info("Using neural style model: {}", filename.get());
                return filename.get();
            }
            log.info("Style profile {} has no trained model, style phase will be skipped", styleProfileId);
        } catch (RuntimeException e) {
            log.warn("Could not load style profile {}: {}", styleProfileId, e.getMessage());
        }
        return null;
    }
    
    private List<PhaseReport> executePhases(PipelineRun run) {
        List<PhaseReport> reports = new ArrayList<>();
        for (PipelinePhaseHandler handler : handlers) {
            run.progress().enterPhase(handler.phase(), run.totalPhotos());
            try {
                reports.add(handler.execute(run));
            } catch (PipelineException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UnhandledPipelineException(handler.phase(), e);
            }
            run.progress().completePhase();
        }
        return reports;
    }
    
    private void finish(PipelineRun run) {
        galleryRepository.findById(run.galleryId()).ifPresent(gallery -> {
            gallery.markReady();
            galleryRepository.save(gallery);
        });
        run.jobId().flatMap(shootJobRepository::findById).ifPresent(job -> {
            job.markReadyForReview();
            shootJobRepository.save(job);
        });
        run.progress().markCompleted();
    }
}
