package com.apelier.aiengine.features.gpu.infra;

import com.apelier.aiengine.features.gallery.domain.DetectedFace;
import com.apelier.aiengine.features.gpu.domain.FaceRetouchResult;
import com.apelier.aiengine.features.gpu.domain.GpuCallStatus;
import com.apelier.aiengine.features.gpu.domain.GpuClient;
import com.apelier.aiengine.features.gpu.domain.GpuHealth;
import com.apelier.aiengine.features.gpu.domain.SceneCleanupResult;
import com.apelier.aiengine.features.gpu.domain.StyleBatchItem;
import com.apelier.aiengine.features.gpu.domain.StyleBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * {@link GpuClient} over HTTP/JSON. The {@link RestTemplate} carries the base URL, timeouts and auth header.
 */
public class RemoteGpuClient implements GpuClient {
    
    private static final Logger log = LoggerFactory.getLogger(RemoteGpuClient.class);
    
    private final RestTemplate restTemplate;
    private volatile boolean closed;
    
    /**
     * @param restTemplate template rooted at the service URL, or null when no service is configured
     */
    public RemoteGpuClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }
    
    @Override
    public boolean isConfigured() {
        return restTemplate != null;
    }
    
    @Override
    public GpuHealth health() {
        if (!isUsable()) {
            return GpuHealth.unavailable();
        }
        try {
            GpuHealth health = restTemplate.getForObject("/health", GpuHealth.class);
            return health != null ? health : GpuHealth.unavailable();
        } catch (RestClientException e) {
            log.warn("GPU health check failed: {}", e.getMessage());
            return GpuHealth.unavailable();
        }
    }
    
    @Override
    public StyleBatchResult applyStyleBatch(List<StyleBatchItem> images, String modelFilename, int jpegQuality) {
        if (!isUsable()) {
            return new StyleBatchResult(GpuCallStatus.UNAVAILABLE, "GPU service unavailable", List.of());
        }
        try {
            StyleBatchResult result = restTemplate.postForObject("/style/batch",
                    new GpuRequests.StyleBatchRequest(images, modelFilename, jpegQuality),
                    StyleBatchResult.class);
            return result != null ? result : StyleBatchResult.error("Empty response");
        } catch (RestClientException e) {
            log.warn("GPU style batch call failed: {}", e.getMessage());
            return StyleBatchResult.error(e.getMessage());
        }
    }
    
    @Override
    public FaceRetouchResult faceRetouch(String imageKey, String outputKey, double fidelity, List<DetectedFace> faceData) {
        if (!isUsable()) {
            return new FaceRetouchResult(GpuCallStatus.UNAVAILABLE, 0, "GPU service unavailable");
        }
        try {
            FaceRetouchResult result = restTemplate.postForObject("/retouch/face",
                    new GpuRequests.FaceRetouchRequest(imageKey, outputKey, fidelity, faceData),
                    FaceRetouchResult.class);
            return result != null ? result : FaceRetouchResult.error("Empty response");
        } catch (RestClientException e) {
            log.warn("GPU face retouch failed for {}: {}", imageKey, e.getMessage());
            return FaceRetouchResult.error(e.getMessage());
        }
    }
    
    @Override
    public SceneCleanupResult sceneCleanup(String imageKey, String outputKey, List<String> detections) {
        if (!isUsable()) {
            return new SceneCleanupResult(GpuCallStatus.UNAVAILABLE, 0, 0.0, "GPU service unavailable");
        }
        try {
            SceneCleanupResult result = restTemplate.postForObject("/cleanup/scene",
                    new GpuRequests.SceneCleanupRequest(imageKey, outputKey, detections),
                    SceneCleanupResult.class);
            return result != null ? result : SceneCleanupResult.error("Empty response");
        } catch (RestClientException e) {
            log.warn("GPU scene cleanup failed for {}: {}", imageKey, e.getMessage());
            return SceneCleanupResult.error(e.getMessage());
        }
    }
    
    @Override
    public void close() {
        closed = true;
    }
    
    private boolean isUsable() {
        return restTemplate != null && !closed;
    }
}
