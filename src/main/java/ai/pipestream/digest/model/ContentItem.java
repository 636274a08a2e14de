package ai.pipestream.digest.model;

/**
 * The latest item published by the monitored source.
 *
 * @param identifier canonical URL of the item, used for change detection
 * @param body plain text extracted from the item
 */
public record ContentItem(String identifier, String body) {
}
