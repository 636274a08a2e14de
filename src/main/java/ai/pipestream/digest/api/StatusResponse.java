package ai.pipestream.digest.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /}.
 *
 * @param status always {@code running} while the process answers
 * @param workerActive whether a polling loop exists
 * @param pingActive whether the self-ping task runs
 * @param lastProcessed identifier of the last delivered item, or null
 * @param cycleCount cycles completed since the process started
 * @param lastOutcome how the most recent cycle ended, or null
 */
public record StatusResponse(
        @JsonProperty("status") String status,
        @JsonProperty("worker_active") boolean workerActive,
        @JsonProperty("ping_active") boolean pingActive,
        @JsonProperty("last_processed") String lastProcessed,
        @JsonProperty("cycle_count") long cycleCount,
        @JsonProperty("last_outcome") String lastOutcome) {
}
