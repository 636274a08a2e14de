package ai.pipestream.digest.client;

import ai.pipestream.digest.model.PipelineStage;

/**
 * Raised when the notification could not be delivered.
 */
public class DeliveryException extends CycleStageException {

    public DeliveryException(String message) {
        super(PipelineStage.DELIVER, message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(PipelineStage.DELIVER, message, cause);
    }
}
