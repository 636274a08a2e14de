package ai.pipestream.digest.service;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Periodically requests this process's own {@code /health} endpoint through its public URL,
 * so hosts that idle out quiet services keep it alive.
 * <p>
 * Activated once at startup. A failed ping is logged and changes nothing else;
 * the worker never sees it.
 */
@ApplicationScoped
public class SelfPingScheduler {

    private static final Logger LOG = Logger.getLogger(SelfPingScheduler.class);

    @Inject
    WebClient webClient;

    @ConfigProperty(name = "digest.ping.url")
    String publicUrl;

    @ConfigProperty(name = "digest.ping.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "digest.http.timeout-ms", defaultValue = "30000")
    long timeoutMs;

    private final PingState pingState = new PingState();

    void onStart(@Observes StartupEvent ev) {
        if (enabled) {
            ConfigurationChecks.requireHttpUrl("digest.ping.url", publicUrl);
            LOG.infof("Self-ping active against %s", healthUrl());
        } else {
            LOG.info("digest.ping.enabled=false; self-ping is inactive");
        }
        pingState.activate(enabled);
    }

    @Scheduled(every = "{digest.ping.interval}",
            identity = "self-ping",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledPing() {
        if (!pingState.isActive()) {
            return Uni.createFrom().voidItem();
        }
        return ping();
    }

    /**
     * Issues one ping. Never fails.
     *
     * @return a Uni completing when the ping finished or failed
     */
    Uni<Void> ping() {
        String target = healthUrl();
        return webClient.getAbs(target)
                .timeout(timeoutMs)
                .send()
                .map(response -> {
                    boolean ok = response.statusCode() / 100 == 2;
                    if (ok) {
                        LOG.debugf("Self-ping to %s succeeded", target);
                    } else {
                        LOG.warnf("Self-ping to %s returned HTTP %d", target, response.statusCode());
                    }
                    return ok;
                })
                .onFailure().invoke(error -> LOG.warnf("Self-ping to %s failed: %s", target, error.getMessage()))
                .onFailure().recoverWithItem(false)
                .invoke(ok -> pingState.recordPing(ok, Instant.now()))
                .replaceWithVoid();
    }

    String healthUrl() {
        String base = publicUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/health";
    }

    /**
     * @return a copy of the ping state
     */
    public PingState.Snapshot snapshot() {
        return pingState.snapshot();
    }
}
