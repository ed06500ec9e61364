package com.apelier.aiengine.features.pipeline.infra;

import com.apelier.aiengine.common.exception.BusinessException;
import com.apelier.aiengine.common.exception.NotFoundException;
import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.pipeline.app.GalleryProcessingService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts gallery processing from SQS messages.
 * <p>
 * Only enabled when spring.cloud.aws.sqs.enabled=true; the queue URL comes from aws.sqs.queue-url.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class ProcessingRequestListener {
    
    private static final Logger log = LoggerFactory.getLogger(ProcessingRequestListener.class);
    
    private final GalleryProcessingService processingService;
    private final ObjectMapper objectMapper;
    
    public ProcessingRequestListener(GalleryProcessingService processingService, ObjectMapper objectMapper) {
        this.processingService = processingService;
        this.objectMapper = objectMapper;
    }
    
    @SqsListener("${aws.sqs.queue-url}")
    public void handleProcessingRequest(String message) {
        log.info("Received processing request: {}", message);
        
        ProcessingRequestMessage request;
        try {
            request = objectMapper.readValue(message, ProcessingRequestMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse processing request", e);
            throw new IllegalArgumentException("Invalid message format", e);
        }
        if (request.galleryId() == null || request.galleryId().isBlank()) {
            log.warn("Ignoring processing request without gallery_id");
            return;
        }
        
        try {
            ProcessingJob job = processingService.submit(request.galleryId(), request.styleProfileId());
            log.info("Processing job {} queued from message for gallery {}", job.getId(), request.galleryId());
        } catch (NotFoundException | BusinessException e) {
            // Redelivery cannot fix these
            log.warn("Rejected processing request for gallery {}: {}", request.galleryId(), e.getMessage());
        }
    }
}
