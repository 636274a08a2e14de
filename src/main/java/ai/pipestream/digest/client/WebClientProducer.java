package ai.pipestream.digest.client;

import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Central factory for the HTTP client shared by the source, summarizer, notifier and self-ping.
 * <p>
 * Connection-level settings live here; each caller bounds its own requests with
 * {@code digest.http.timeout-ms}.
 */
@Singleton
public class WebClientProducer {

    private static final Logger LOG = Logger.getLogger(WebClientProducer.class);

    @ConfigProperty(name = "digest.http.user-agent", defaultValue = "pipestream-post-digest")
    String userAgent;

    @ConfigProperty(name = "digest.http.connect-timeout-ms", defaultValue = "10000")
    int connectTimeoutMs;

    @Produces
    @Singleton
    WebClient webClient(Vertx vertx) {
        LOG.debugf("Creating shared WebClient (user-agent=%s, connect-timeout=%dms)", userAgent, connectTimeoutMs);
        WebClientOptions options = new WebClientOptions()
                .setUserAgent(userAgent)
                .setConnectTimeout(connectTimeoutMs)
                .setFollowRedirects(true);
        return WebClient.create(vertx, options);
    }

    void close(@Disposes WebClient webClient) {
        webClient.close();
    }
}
