package ai.pipestream.digest.client;

import ai.pipestream.digest.model.PipelineStage;

/**
 * Failure of a single stage of a processing cycle.
 * <p>
 * These failures are scoped to one cycle: the pipeline records them as a failed
 * outcome and the worker retries on its next tick.
 */
public abstract class CycleStageException extends RuntimeException {

    private final PipelineStage stage;

    protected CycleStageException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected CycleStageException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * @return the stage that failed
     */
    public PipelineStage stage() {
        return stage;
    }
}
