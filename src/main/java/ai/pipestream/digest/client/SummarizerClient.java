package ai.pipestream.digest.client;

import ai.pipestream.digest.model.ContentItem;
import ai.pipestream.digest.model.Summary;
import io.smallrye.mutiny.Uni;

/**
 * Turns an item's body into a short summary via a remote model.
 */
public interface SummarizerClient {

    /**
     * Summarizes the body of the given item.
     *
     * @param item the item whose body is summarized
     * @return a Uni resolving to a non-blank summary, or failing with {@link SummarizationException}
     */
    Uni<Summary> summarize(ContentItem item);
}
