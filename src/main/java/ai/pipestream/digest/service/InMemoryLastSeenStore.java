package ai.pipestream.digest.service;

import io.smallrye.mutiny.Uni;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the marker for the lifetime of the process only.
 */
public class InMemoryLastSeenStore implements LastSeenStore {

    private final AtomicReference<String> identifier = new AtomicReference<>();

    @Override
    public Uni<Optional<String>> load() {
        return Uni.createFrom().item(() -> Optional.ofNullable(identifier.get()));
    }

    @Override
    public Uni<Void> save(String identifier) {
        return Uni.createFrom().item(() -> {
            this.identifier.set(identifier);
            return null;
        });
    }
}
