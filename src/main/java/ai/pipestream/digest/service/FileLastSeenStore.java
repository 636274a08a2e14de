package ai.pipestream.digest.service;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Stores the marker as the only line of a text file, through the Vert.x file system.
 */
public class FileLastSeenStore implements LastSeenStore {

    private static final Logger LOG = Logger.getLogger(FileLastSeenStore.class);

    private final Vertx vertx;
    private final String path;

    public FileLastSeenStore(Vertx vertx, String path) {
        this.vertx = vertx;
        this.path = path;
    }

    @Override
    public Uni<Optional<String>> load() {
        return vertx.fileSystem().exists(path)
                .flatMap(exists -> {
                    if (!exists) {
                        LOG.debugf("No marker file at %s yet", path);
                        return Uni.createFrom().item(Optional.<String>empty());
                    }
                    return vertx.fileSystem().readFile(path)
                            .map(buffer -> Optional.of(buffer.toString().trim())
                                    .filter(identifier -> !identifier.isEmpty()));
                });
    }

    @Override
    public Uni<Void> save(String identifier) {
        return vertx.fileSystem().writeFile(path, Buffer.buffer(identifier + "\n"))
                .invoke(() -> LOG.debugf("Wrote marker %s to %s", identifier, path));
    }

    public String path() {
        return path;
    }
}
