package ai.pipestream.digest.model;

/**
 * Stages of one processing cycle, in execution order.
 */
public enum PipelineStage {
    /** Fetching the latest item from the source */
    FETCH,
    /** Summarizing the item body */
    SUMMARIZE,
    /** Delivering the summary to the recipients */
    DELIVER,
    /** Writing the last-seen marker to the durable store */
    PERSIST
}
