package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs pipelines on the {@code pipelineExecutor} pool, one thread per gallery.
 */
@Component
public class PipelineJobDispatcher {
    
    private static final Logger log = LoggerFactory.getLogger(PipelineJobDispatcher.class);
    
    private final PipelineOrchestrator orchestrator;
    
    public PipelineJobDispatcher(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }
    
    @Async("pipelineExecutor")
    public void dispatch(PipelineRequest request) {
        log.debug("Pipeline run started on {} for processing job {}",
                Thread.currentThread().getName(), request.processingJobId());
        orchestrator.run(request);
    }
}
