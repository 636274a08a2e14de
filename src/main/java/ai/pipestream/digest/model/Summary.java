package ai.pipestream.digest.model;

/**
 * Summarized form of a {@link ContentItem}'s body.
 *
 * @param sourceId identifier of the item the summary was produced from
 * @param text summary text, never blank
 */
public record Summary(String sourceId, String text) {
}
