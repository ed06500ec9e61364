package com.apelier.aiengine.integration;

import com.apelier.aiengine.common.exception.BusinessException;
import com.apelier.aiengine.features.gallery.domain.Gallery;
import com.apelier.aiengine.features.gallery.domain.GalleryRepository;
import com.apelier.aiengine.features.gallery.domain.GalleryStatus;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.gallery.domain.ProcessingJobRepository;
import com.apelier.aiengine.features.gallery.domain.ProcessingStatus;
import com.apelier.aiengine.features.gallery.domain.ShootJob;
import com.apelier.aiengine.features.gallery.domain.ShootJobRepository;
import com.apelier.aiengine.features.pipeline.app.GalleryProcessingService;
import com.apelier.aiengine.features.pipeline.app.PipelineOrchestrator;
import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;
import com.apelier.aiengine.features.storage.domain.StorageKeys;
import com.apelier.aiengine.support.TestImages;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the whole pipeline against PostgreSQL and LocalStack S3 with no GPU service configured.
 */
@ActiveProfiles("test")
@Import(TestAwsConfig.class)
class GalleryPipelineIntegrationTest extends BaseIntegrationTest {
    
    @Autowired
    private GalleryProcessingService galleryProcessingService;
    
    @Autowired
    private PipelineOrchestrator pipelineOrchestrator;
    
    @Autowired
    private GalleryRepository galleryRepository;
    
    @Autowired
    private ShootJobRepository shootJobRepository;
    
    @Autowired
    private PhotoRepository photoRepository;
    
    @Autowired
    private ProcessingJobRepository processingJobRepository;
    
    @Test
    void shouldProcessGalleryToEditedPhotos() {
        String photographerId = "photographer-" + UUID.randomUUID();
        String galleryId = UUID.randomUUID().toString();
        String shootJobId = UUID.randomUUID().toString();
        shootJobRepository.save(new ShootJob(shootJobId, "delivered_raw"));
        galleryRepository.save(new Gallery(galleryId, photographerId, shootJobId));
        
        for (int i = 1; i <= 3; i++) {
            String filename = "IMG_000" + i + ".jpg";
            String key = photographerId + "/" + galleryId + "/uploads/" + filename;
            uploadToS3(key, TestImages.jpeg(TestImages.blocks(640, 480, 32, i)), StorageKeys.JPEG_CONTENT_TYPE);
            photoRepository.save(new Photo(galleryId + "-" + i, galleryId, filename, key, i));
        }
        
        ProcessingJob queued = galleryProcessingService.submit(galleryId, null);
        assertEquals(ProcessingStatus.QUEUED, queued.getStatus());
        assertEquals(3, queued.getTotalImages());
        
        await().atMost(Duration.ofSeconds(90))
                .pollInterval(Duration.ofMillis(500))
                .untilAsserted(() -> {
                    ProcessingJob job = processingJobRepository.findById(queued.getId()).orElseThrow();
                    assertEquals(ProcessingStatus.COMPLETED, job.getStatus());
                });
        
        ProcessingJob job = processingJobRepository.findById(queued.getId()).orElseThrow();
        assertEquals(PipelinePhase.OUTPUT, job.getCurrentPhase());
        assertEquals(3, job.getProcessedImages());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
        
        List<Photo> photos = photoRepository.findByGalleryIdAndCulledFalseOrderBySortOrderAsc(galleryId);
        assertEquals(3, photos.size());
        for (Photo photo : photos) {
            assertEquals(GalleryStatus.PHOTO_EDITED, photo.getStatus());
            assertNotNull(photo.getSceneType());
            assertNotNull(photo.getQualityDetails());
            assertEquals(640, photo.getWidth());
            assertEquals(480, photo.getHeight());
            assertEquals(Boolean.TRUE, photo.getAiEdits().composition().evaluated());
            assertEquals("2.0", photo.getAiEdits().pipelineVersion());
            assertTrue(existsInS3(photo.getEditedKey()), photo.getEditedKey());
            assertTrue(existsInS3(photo.getWebKey()), photo.getWebKey());
            assertTrue(existsInS3(photo.getThumbKey()), photo.getThumbKey());
        }
        
        assertEquals(GalleryStatus.GALLERY_READY, galleryRepository.findById(galleryId).orElseThrow().getStatus());
        assertEquals(GalleryStatus.JOB_READY_FOR_REVIEW, shootJobRepository.findById(shootJobId).orElseThrow().getStatus());
    }
    
    @Test
    void shouldRejectGalleryWithoutPhotos() {
        String galleryId = UUID.randomUUID().toString();
        galleryRepository.save(new Gallery(galleryId, "photographer-1", null));
        
        assertThrows(BusinessException.class, () -> galleryProcessingService.submit(galleryId, null));
    }
    
    @Test
    void shouldFailJobWhenPhotosDisappearBeforeTheRun() {
        String galleryId = UUID.randomUUID().toString();
        galleryRepository.save(new Gallery(galleryId, "photographer-1", null));
        ProcessingJob job = processingJobRepository.save(
                new ProcessingJob(UUID.randomUUID().toString(), galleryId, "photographer-1", null, 2));
        
        assertTrue(pipelineOrchestrator.run(PipelineRequest.of(galleryId, job.getId(), null)).isEmpty());
        
        ProcessingJob failed = processingJobRepository.findById(job.getId()).orElseThrow();
        assertEquals(ProcessingStatus.FAILED, failed.getStatus());
        assertEquals("No photos found", failed.getErrorLog());
        assertEquals(PipelinePhase.QUEUED, failed.getCurrentPhase());
        assertNull(failed.getStartedAt());
    }
}
