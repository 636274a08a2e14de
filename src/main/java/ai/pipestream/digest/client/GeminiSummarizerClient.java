package ai.pipestream.digest.client;

import ai.pipestream.digest.model.ContentItem;
import ai.pipestream.digest.model.Summary;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Summarizes item bodies with the Gemini {@code generateContent} REST endpoint.
 * <p>
 * The summary is requested as an HTML fragment so it can be dropped straight into
 * an email body.
 */
@ApplicationScoped
public class GeminiSummarizerClient implements SummarizerClient {

    private static final Logger LOG = Logger.getLogger(GeminiSummarizerClient.class);

    static final String PROMPT_TEMPLATE = """
            Summarize the following text and format it to be sent as HtmlBody parameter in a email API. \
            Don't add triple backticks to denote the block of text. \
            simply the HTML without even HEAD or BODY tags.
            %s

            Summary:""";

    @Inject
    WebClient webClient;

    @ConfigProperty(name = "digest.summarizer.api-key")
    String apiKey;

    @ConfigProperty(name = "digest.summarizer.base-url", defaultValue = "https://generativelanguage.googleapis.com")
    String baseUrl;

    @ConfigProperty(name = "digest.summarizer.model", defaultValue = "gemini-1.5-pro-latest")
    String model;

    @ConfigProperty(name = "digest.http.timeout-ms", defaultValue = "30000")
    long timeoutMs;

    @Override
    public Uni<Summary> summarize(ContentItem item) {
        LOG.debugf("Summarizing %s (%d characters) with %s", item.identifier(), item.body().length(), model);

        JsonObject request = new JsonObject()
                .put("contents", new JsonArray().add(new JsonObject()
                        .put("role", "user")
                        .put("parts", new JsonArray().add(new JsonObject()
                                .put("text", PROMPT_TEMPLATE.formatted(item.body()))))));

        return webClient.postAbs(endpoint())
                .putHeader("x-goog-api-key", apiKey)
                .timeout(timeoutMs)
                .sendJsonObject(request)
                .map(response -> {
                    if (response.statusCode() / 100 != 2) {
                        throw new SummarizationException("Summarizer returned HTTP " + response.statusCode()
                                + " for " + item.identifier() + ": " + response.bodyAsString());
                    }
                    return new Summary(item.identifier(), extractText(response.bodyAsJsonObject()));
                })
                .onFailure(t -> !(t instanceof SummarizationException))
                .transform(t -> new SummarizationException("Summarization failed for " + item.identifier(), t))
                .invoke(summary -> LOG.debugf("Summary for %s has %d characters",
                        item.identifier(), summary.text().length()));
    }

    private String endpoint() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/v1beta/models/" + model + ":generateContent";
    }

    /**
     * Pulls the text out of a {@code generateContent} response.
     *
     * @param body the decoded response body
     * @return the trimmed text of the first candidate
     * @throws SummarizationException if the prompt was blocked or no text came back
     */
    static String extractText(JsonObject body) {
        if (body == null) {
            throw new SummarizationException("Summarizer returned an empty response");
        }
        JsonObject feedback = body.getJsonObject("promptFeedback");
        if (feedback != null && feedback.getString("blockReason") != null) {
            throw new SummarizationException("Prompt was blocked: " + feedback.getString("blockReason"));
        }
        JsonArray candidates = body.getJsonArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            throw new SummarizationException("Summarizer returned no candidates");
        }
        JsonObject content = candidates.getJsonObject(0).getJsonObject("content");
        JsonArray parts = content != null ? content.getJsonArray("parts") : null;
        StringBuilder text = new StringBuilder();
        if (parts != null) {
            for (int i = 0; i < parts.size(); i++) {
                String part = parts.getJsonObject(i).getString("text");
                if (part != null) {
                    text.append(part);
                }
            }
        }
        String summary = text.toString().trim();
        if (summary.isEmpty()) {
            throw new SummarizationException("Summarizer returned empty text");
        }
        return summary;
    }
}
