package com.apelier.aiengine.features.gpu.infra;

import com.apelier.aiengine.common.config.GpuProperties;
import com.apelier.aiengine.features.gallery.domain.DetectedFace;
import com.apelier.aiengine.features.gpu.domain.FaceRetouchResult;
import com.apelier.aiengine.features.gpu.domain.GpuCallStatus;
import com.apelier.aiengine.features.gpu.domain.GpuClient;
import com.apelier.aiengine.features.gpu.domain.SceneCleanupResult;
import com.apelier.aiengine.features.gpu.domain.StyleBatchItem;
import com.apelier.aiengine.features.gpu.domain.StyleBatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteGpuClientTest {
    
    private static final String BASE_URL = "http://gpu.test";
    
    private MockRestServiceServer server;
    private RemoteGpuClient client;
    
    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RemoteGpuClient(restTemplate);
    }
    
    @Test
    void healthReportsServiceStatus() {
        server.expect(requestTo(BASE_URL + "/health"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));
        
        assertTrue(client.health().isNominal());
        server.verify();
    }
    
    @Test
    void styleBatchSendsSnakeCaseBodyAndReadsPerImageStatus() {
        server.expect(requestTo(BASE_URL + "/style/batch"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.model_filename").value("model.cube"))
            .andExpect(jsonPath("$.jpeg_quality").value(95))
            .andExpect(jsonPath("$.images[0].image_key").value("g/uploads/a.jpg"))
            .andExpect(jsonPath("$.images[0].output_key").value("g/edited/a.jpg"))
            .andExpect(jsonPath("$.images[0].status").doesNotExist())
            .andRespond(withSuccess("""
                {"status":"success","results":[
                  {"image_key":"g/uploads/a.jpg","output_key":"g/edited/a.jpg","status":"success"},
                  {"image_key":"g/uploads/b.jpg","output_key":"g/edited/b.jpg","status":"error"}
                ]}
                """, MediaType.APPLICATION_JSON));
        
        StyleBatchResult result = client.applyStyleBatch(
            List.of(new StyleBatchItem("g/uploads/a.jpg", "g/edited/a.jpg"),
                    new StyleBatchItem("g/uploads/b.jpg", "g/edited/b.jpg")),
            "model.cube", 95);
        
        assertFalse(result.isError());
        assertEquals(2, result.results().size());
        assertEquals(GpuCallStatus.SUCCESS, result.results().get(0).status());
        assertEquals(GpuCallStatus.ERROR, result.results().get(1).status());
        server.verify();
    }
    
    @Test
    void faceRetouchSendsStoredFaceShape() {
        server.expect(requestTo(BASE_URL + "/retouch/face"))
            .andExpect(jsonPath("$.image_key").value("in.jpg"))
            .andExpect(jsonPath("$.fidelity").value(0.7))
            .andExpect(jsonPath("$.face_data[0].bbox[2]").value(40))
            .andExpect(jsonPath("$.face_data[0].eyes_open").value(true))
            .andRespond(withSuccess("{\"status\":\"success\",\"faces_found\":1}", MediaType.APPLICATION_JSON));
        
        FaceRetouchResult result = client.faceRetouch("in.jpg", "out.jpg", 0.7,
            List.of(new DetectedFace(List.of(10, 20, 40, 40), true)));
        
        assertTrue(result.isSuccess());
        assertEquals(1, result.facesFound());
        server.verify();
    }
    
    @Test
    void sceneCleanupReadsDetectionCounts() {
        server.expect(requestTo(BASE_URL + "/cleanup/scene"))
            .andExpect(jsonPath("$.detections[0]").value("power_lines"))
            .andRespond(withSuccess(
                "{\"status\":\"success\",\"detections_found\":3,\"mask_coverage_pct\":1.25}",
                MediaType.APPLICATION_JSON));
        
        SceneCleanupResult result = client.sceneCleanup("in.jpg", "out.jpg", List.of("power_lines", "exit_signs"));
        
        assertTrue(result.isSuccess());
        assertEquals(3, result.detectionsFound());
        assertEquals(1.25, result.maskCoveragePct(), 1e-9);
    }
    
    @Test
    void serverErrorsBecomeErrorResults() {
        server.expect(requestTo(BASE_URL + "/style/batch")).andRespond(withServerError());
        server.expect(requestTo(BASE_URL + "/retouch/face")).andRespond(withServerError());
        
        assertTrue(client.applyStyleBatch(List.of(), "m", 95).isError());
        FaceRetouchResult retouch = client.faceRetouch("in.jpg", "out.jpg", 0.7, List.of());
        assertFalse(retouch.isSuccess());
        assertEquals(GpuCallStatus.ERROR, retouch.status());
    }
    
    @Test
    void healthFailureIsUnavailable() {
        server.expect(requestTo(BASE_URL + "/health")).andRespond(withServerError());
        
        assertFalse(client.health().isNominal());
    }
    
    @Test
    void closedSessionMakesNoCalls() {
        client.close();
        
        assertEquals(GpuCallStatus.UNAVAILABLE, client.health().status());
        assertTrue(client.applyStyleBatch(List.of(), "m", 95).isError());
        assertEquals(GpuCallStatus.UNAVAILABLE, client.sceneCleanup("a", "b", List.of()).status());
        server.verify();
    }
    
    @Test
    void unconfiguredFactoryHandsOutUnavailableClients() {
        GpuProperties properties = new GpuProperties();
        properties.setBaseUrl("");
        
        try (GpuClient unconfigured = new RemoteGpuClientFactory(new RestTemplateBuilder(), properties).open()) {
            assertFalse(unconfigured.isConfigured());
            assertFalse(unconfigured.health().isNominal());
            assertEquals(GpuCallStatus.UNAVAILABLE, unconfigured.faceRetouch("a", "b", 0.7, List.of()).status());
        }
    }
}
