package com.apelier.aiengine.features.gpu.infra;

import com.apelier.aiengine.common.config.GpuProperties;
import com.apelier.aiengine.features.gpu.domain.GpuClient;
import com.apelier.aiengine.features.gpu.domain.GpuClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Builds the shared {@link RestTemplate} for the GPU service once and hands out per-run sessions.
 */
@Component
public class RemoteGpuClientFactory implements GpuClientFactory {
    
    private static final Logger log = LoggerFactory.getLogger(RemoteGpuClientFactory.class);
    
    private final RestTemplate restTemplate;
    
    public RemoteGpuClientFactory(RestTemplateBuilder builder, GpuProperties properties) {
        if (!properties.isConfigured()) {
            log.info("No GPU service configured, GPU phases will be skipped");
            this.restTemplate = null;
            return;
        }
        RestTemplateBuilder configured = builder
                .rootUri(stripTrailingSlash(properties.getBaseUrl()))
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout());
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
        }
        this.restTemplate = configured.build();
        log.info("GPU service endpoint: {}", properties.getBaseUrl());
    }
    
    @Override
    public GpuClient open() {
        return new RemoteGpuClient(restTemplate);
    }
    
    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
