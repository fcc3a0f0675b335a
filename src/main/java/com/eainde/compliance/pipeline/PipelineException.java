package com.eainde.compliance.pipeline;

import com.eainde.compliance.model.PipelineStage;

/**
 * Fatal failure of a technical stage. The audit cannot produce a report body.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, Throwable cause) {
        super(stage.label() + " stage failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
