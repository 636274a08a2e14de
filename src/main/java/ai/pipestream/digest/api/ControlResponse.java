package ai.pipestream.digest.api;

/**
 * Body of {@code POST /start} and {@code POST /stop}.
 *
 * @param status what the request did, in words
 */
public record ControlResponse(String status) {
}
