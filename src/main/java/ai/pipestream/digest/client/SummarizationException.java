package ai.pipestream.digest.client;

import ai.pipestream.digest.model.PipelineStage;

/**
 * Raised when the summarizer failed or returned no usable text.
 */
public class SummarizationException extends CycleStageException {

    public SummarizationException(String message) {
        super(PipelineStage.SUMMARIZE, message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(PipelineStage.SUMMARIZE, message, cause);
    }
}
