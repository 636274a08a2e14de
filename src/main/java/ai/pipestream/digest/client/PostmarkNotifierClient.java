package ai.pipestream.digest.client;

import ai.pipestream.digest.model.Summary;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Emails summaries through the Postmark {@code /email} API.
 * <p>
 * All recipients share one message. Postmark reports rejections either with a
 * non-2xx status or with a non-zero {@code ErrorCode}; both are delivery failures.
 */
@ApplicationScoped
public class PostmarkNotifierClient implements NotifierClient {

    private static final Logger LOG = Logger.getLogger(PostmarkNotifierClient.class);

    @Inject
    WebClient webClient;

    @ConfigProperty(name = "digest.notifier.server-token")
    String serverToken;

    @ConfigProperty(name = "digest.notifier.sender")
    String sender;

    @ConfigProperty(name = "digest.notifier.base-url", defaultValue = "https://api.postmarkapp.com")
    String baseUrl;

    @ConfigProperty(name = "digest.notifier.subject", defaultValue = "Summary of the latest Substack post")
    String subject;

    @ConfigProperty(name = "digest.notifier.message-stream")
    Optional<String> messageStream;

    @ConfigProperty(name = "digest.http.timeout-ms", defaultValue = "30000")
    long timeoutMs;

    @Override
    public Uni<Void> send(Summary summary, List<String> recipients) {
        String to = String.join(",", recipients);
        JsonObject email = new JsonObject()
                .put("From", sender)
                .put("To", to)
                .put("Subject", subject)
                .put("HtmlBody", htmlBody("Summary of " + summary.sourceId() + ":\n\n" + summary.text()));
        messageStream.filter(stream -> !stream.isBlank())
                .ifPresent(stream -> email.put("MessageStream", stream));

        LOG.debugf("Sending summary of %s to %d recipient(s)", summary.sourceId(), recipients.size());

        return webClient.postAbs(endpoint())
                .putHeader("Accept", "application/json")
                .putHeader("X-Postmark-Server-Token", serverToken)
                .timeout(timeoutMs)
                .sendJsonObject(email)
                .map(response -> {
                    JsonObject result = decode(response.bodyAsString());
                    int errorCode = result.getInteger("ErrorCode", response.statusCode() / 100 == 2 ? 0 : -1);
                    if (response.statusCode() / 100 != 2 || errorCode != 0) {
                        throw new DeliveryException("Postmark rejected summary of " + summary.sourceId()
                                + " (HTTP " + response.statusCode() + ", ErrorCode " + errorCode + "): "
                                + result.getString("Message", ""));
                    }
                    return result.getString("MessageID", "");
                })
                .onFailure(t -> !(t instanceof DeliveryException))
                .transform(t -> new DeliveryException("Delivery failed for " + summary.sourceId(), t))
                .invoke(messageId -> LOG.infof("Delivered summary of %s to %s (message %s)",
                        summary.sourceId(), to, messageId))
                .replaceWithVoid();
    }

    private String endpoint() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/email";
    }

    private static JsonObject decode(String body) {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            return new JsonObject(body);
        } catch (DecodeException e) {
            LOG.debugf("Postmark response is not JSON: %s", body);
            return new JsonObject();
        }
    }

    /**
     * Renders plain text as HTML paragraphs, one per line.
     *
     * @param text the message text
     * @return the HTML body
     */
    static String htmlBody(String text) {
        return "<p>" + text.replace("\n", "</p><p>") + "</p>";
    }
}
