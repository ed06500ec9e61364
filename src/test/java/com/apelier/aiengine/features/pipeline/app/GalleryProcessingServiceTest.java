package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.common.exception.BusinessException;
import com.apelier.aiengine.common.exception.NotFoundException;
import com.apelier.aiengine.features.gallery.domain.Gallery;
import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.gallery.domain.ProcessingStatus;
import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;
import com.apelier.aiengine.support.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GalleryProcessingServiceTest {
    
    private final InMemoryRepositories.Galleries galleries = new InMemoryRepositories.Galleries();
    private final InMemoryRepositories.Photos photos = new InMemoryRepositories.Photos();
    private final InMemoryRepositories.ProcessingJobs processingJobs = new InMemoryRepositories.ProcessingJobs();
    private PipelineJobDispatcher dispatcher;
    private GalleryProcessingService service;
    
    @BeforeEach
    void setUp() {
        dispatcher = mock(PipelineJobDispatcher.class);
        service = new GalleryProcessingService(galleries, photos, processingJobs, dispatcher);
        galleries.save(new Gallery("g1", "p1", "job1"));
    }
    
    @Test
    void queuesJobAndDispatchesRun() {
        photos.save(new Photo("a", "g1", "a.jpg", "p1/g1/uploads/a.jpg", 1));
        photos.save(new Photo("b", "g1", "b.jpg", "p1/g1/uploads/b.jpg", 2));
        Photo culled = new Photo("c", "g1", "c.jpg", "p1/g1/uploads/c.jpg", 3);
        culled.cull();
        photos.save(culled);
        
        ProcessingJob job = service.submit("g1", "sp1");
        
        assertEquals(ProcessingStatus.QUEUED, job.getStatus());
        assertEquals(PipelinePhase.QUEUED, job.getCurrentPhase());
        assertEquals(2, job.getTotalImages());
        assertEquals(0, job.getProcessedImages());
        assertTrue(processingJobs.findById(job.getId()).isPresent());
        
        ArgumentCaptor<PipelineRequest> request = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(dispatcher).dispatch(request.capture());
        assertEquals(new PipelineRequest("g1", job.getId(), "p1", "job1", "sp1"), request.getValue());
    }
    
    @Test
    void rejectedDispatchFailsTheQueuedJob() {
        photos.save(new Photo("a", "g1", "a.jpg", "p1/g1/uploads/a.jpg", 1));
        doThrow(new TaskRejectedException("pipelineExecutor queue full")).when(dispatcher).dispatch(any());
        
        BusinessException error = assertThrows(BusinessException.class, () -> service.submit("g1", null));
        
        assertEquals(GalleryProcessingService.PIPELINE_BUSY, error.getCode());
        assertEquals(1, processingJobs.all().size());
        ProcessingJob job = processingJobs.all().get(0);
        assertEquals(ProcessingStatus.FAILED, job.getStatus());
        assertNotNull(job.getErrorLog());
        assertNotNull(job.getCompletedAt());
    }
    
    @Test
    void unknownGalleryIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.submit("missing", null));
        verify(dispatcher, never()).dispatch(any());
    }
    
    @Test
    void galleryWithoutPhotosIsRejected() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.submit("g1", null));
        
        assertEquals(GalleryProcessingService.NO_PHOTOS, error.getCode());
        assertTrue(processingJobs.history().isEmpty());
        verify(dispatcher, never()).dispatch(any());
    }
}
