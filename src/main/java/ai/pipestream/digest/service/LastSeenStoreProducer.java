package ai.pipestream.digest.service;

import io.vertx.mutiny.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Chooses the marker store: a file when {@code digest.state.file} is set, memory otherwise.
 */
@ApplicationScoped
public class LastSeenStoreProducer {

    private static final Logger LOG = Logger.getLogger(LastSeenStoreProducer.class);

    @ConfigProperty(name = "digest.state.file")
    Optional<String> stateFile;

    @Produces
    @ApplicationScoped
    LastSeenStore lastSeenStore(Vertx vertx) {
        return stateFile.filter(path -> !path.isBlank())
                .<LastSeenStore>map(path -> {
                    LOG.infof("Last-seen marker is stored in %s", path);
                    return new FileLastSeenStore(vertx, path);
                })
                .orElseGet(() -> {
                    LOG.info("digest.state.file not set; last-seen marker is kept in memory only");
                    return new InMemoryLastSeenStore();
                });
    }
}
