package ai.pipestream.digest.service;

import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Durable home of the last-seen marker, so a restart does not re-notify the latest item.
 */
public interface LastSeenStore {

    /**
     * @return the stored identifier, or empty if nothing was delivered yet
     */
    Uni<Optional<String>> load();

    /**
     * Replaces the stored identifier.
     *
     * @param identifier identifier of the item just delivered
     * @return a Uni completing once the identifier is stored
     */
    Uni<Void> save(String identifier);
}
