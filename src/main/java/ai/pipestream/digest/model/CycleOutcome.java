package ai.pipestream.digest.model;

/**
 * Result of one run of the processing pipeline.
 * <p>
 * Only {@link Kind#DELIVERED} carries a new identifier for the worker to record.
 *
 * @param kind what the cycle ended with
 * @param newId identifier to record as last seen, set only for {@link Kind#DELIVERED}
 * @param observedId identifier reported by the source, if the fetch succeeded
 * @param failedStage stage that failed, set only for {@link Kind#FAILED}
 * @param error cause of the failure, set only for {@link Kind#FAILED}
 */
public record CycleOutcome(Kind kind, String newId, String observedId,
                           PipelineStage failedStage, Throwable error) {

    /**
     * How a cycle ended.
     */
    public enum Kind {
        /** A new item was summarized and delivered */
        DELIVERED,
        /** The source still reports the last seen item */
        NO_CHANGE,
        /** A stage failed; the marker must not move */
        FAILED
    }

    public static CycleOutcome delivered(String identifier) {
        return new CycleOutcome(Kind.DELIVERED, identifier, identifier, null, null);
    }

    public static CycleOutcome noChange(String identifier) {
        return new CycleOutcome(Kind.NO_CHANGE, null, identifier, null, null);
    }

    public static CycleOutcome failed(PipelineStage stage, String observedId, Throwable error) {
        return new CycleOutcome(Kind.FAILED, null, observedId, stage, error);
    }

    public boolean notified() {
        return kind == Kind.DELIVERED;
    }
}
