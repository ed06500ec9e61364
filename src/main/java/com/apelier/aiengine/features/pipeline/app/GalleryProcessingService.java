package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.exception.BusinessException;
import com.apelier.aiengine.common.exception.NotFoundException;
import com.apelier.aiengine.features.gallery.domain.Gallery;
import com.apelier.aiengine.features.gallery.domain.GalleryRepository;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.gallery.domain.ProcessingJobRepository;
import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for processing a gallery: creates the queued processing job and hands the run to the executor.
 */
@Service
public class GalleryProcessingService {
    
    private static final Logger log = LoggerFactory.getLogger(GalleryProcessingService.class);
    
    public static final String NO_PHOTOS = "NO_PHOTOS";
    public static final String PIPELINE_BUSY = "PIPELINE_BUSY";
    
    private final GalleryRepository galleryRepository;
    private final PhotoRepository photoRepository;
    private final ProcessingJobRepository processingJobRepository;
    private final PipelineJobDispatcher dispatcher;
    
    public GalleryProcessingService(
            GalleryRepository galleryRepository,
            PhotoRepository photoRepository,
            ProcessingJobRepository processingJobRepository,
            PipelineJobDispatcher dispatcher) {
        this.galleryRepository = galleryRepository;
        this.photoRepository = photoRepository;
        this.processingJobRepository = processingJobRepository;
        this.dispatcher = dispatcher;
    }
    
    /**
     * Queue a pipeline run for a gallery.
     *
     * @param galleryId gallery to process
     * @param styleProfileId style profile to apply, or null to skip the style phase
     * @return the queued processing job, which the run updates as it progresses
     * @throws NotFoundException if the gallery does not exist
     * @throws BusinessException with code {@link #NO_PHOTOS} if the gallery has no non-culled photos,
     *         or {@link #PIPELINE_BUSY} if the executor queue is full (the job is then marked failed)
     */
    public ProcessingJob submit(String galleryId, String styleProfileId) {
        Gallery gallery = galleryRepository.findById(galleryId)
                .orElseThrow(() -> new NotFoundException("Gallery not found: " + galleryId));
        
        long photoCount = photoRepository.countByGalleryIdAndCulledFalse(galleryId);
        if (photoCount == 0) {
            throw new BusinessException(NO_PHOTOS, "Gallery " + galleryId + " has no photos to process");
        }
        
        ProcessingJob job = processingJobRepository.save(new ProcessingJob(
                UUID.randomUUID().toString(),
                galleryId,
                gallery.getPhotographerId(),
                styleProfileId,
                (int) photoCount));
        
        log.info("Queued processing job {} for gallery {} ({} photos)", job.getId(), galleryId, photoCount);
        try {
            dispatcher.dispatch(new PipelineRequest(galleryId, job.getId(),
                    gallery.getPhotographerId(), gallery.getJobId(), styleProfileId));
        } catch (TaskRejectedException e) {
            log.warn("Pipeline executor rejected processing job {}: {}", job.getId(), e.getMessage());
            job.markFailed("Pipeline executor is at capacity, retry later");
            processingJobRepository.save(job);
            throw new BusinessException(PIPELINE_BUSY, "Too many galleries are processing, retry later");
        }
        return job;
    }
}
