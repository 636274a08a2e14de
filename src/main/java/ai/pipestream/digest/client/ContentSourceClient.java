package ai.pipestream.digest.client;

import ai.pipestream.digest.model.ContentItem;
import io.smallrye.mutiny.Uni;

/**
 * Reads the newest item from the monitored source.
 */
public interface ContentSourceClient {

    /**
     * Fetches the latest item with its body text.
     *
     * @return a Uni resolving to the item, or failing with {@link ContentFetchException}
     */
    Uni<ContentItem> fetchLatest();
}
