package ai.pipestream.digest.api;

/**
 * Body of {@code GET /health}.
 *
 * @param status always {@code healthy}
 * @param timestamp current time in epoch seconds
 */
public record HealthResponse(String status, long timestamp) {
}
