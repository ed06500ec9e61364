package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.PipelinePhase;
import com.apelier.aiengine.features.pipeline.domain.PhaseReport;

/**
 * One of the six pipeline phases. The orchestrator resets progress before {@link #execute} and sets it to the
 * total afterwards; handlers advance it per photo. Per-photo failures are reported as skipped outcomes.
 * An exception thrown from {@link #execute} fails the whole run.
 */
public interface PipelinePhaseHandler {
    
    PipelinePhase phase();
    
    PhaseReport execute(PipelineRun run);
}
