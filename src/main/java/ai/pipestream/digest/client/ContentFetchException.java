package ai.pipestream.digest.client;

import ai.pipestream.digest.model.PipelineStage;

/**
 * Raised when the latest item could not be fetched or extracted from the source.
 */
public class ContentFetchException extends CycleStageException {

    public ContentFetchException(String message) {
        super(PipelineStage.FETCH, message);
    }

    public ContentFetchException(String message, Throwable cause) {
        super(PipelineStage.FETCH, message, cause);
    }
}
