package ai.pipestream.digest.client;

import ai.pipestream.digest.model.ContentItem;
import ai.pipestream.digest.service.ConfigurationChecks;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.stream.Collectors;

/**
 * Scrapes the latest post of a Substack publication.
 * <p>
 * Two requests per call:
 * <ol>
 *   <li>the publication page, where the first element matching
 *       {@code digest.source.link-selector} links to the newest post</li>
 *   <li>the post itself, whose paragraphs under {@code digest.source.body-selector}
 *       form the body text</li>
 * </ol>
 * The absolute post URL is the item identifier.
 */
@ApplicationScoped
public class SubstackContentSourceClient implements ContentSourceClient {

    private static final Logger LOG = Logger.getLogger(SubstackContentSourceClient.class);

    @Inject
    WebClient webClient;

    @ConfigProperty(name = "digest.source.url")
    String sourceUrl;

    @ConfigProperty(name = "digest.source.link-selector", defaultValue = "a.sitemap-link")
    String linkSelector;

    @ConfigProperty(name = "digest.source.body-selector", defaultValue = "div.body")
    String bodySelector;

    @ConfigProperty(name = "digest.http.timeout-ms", defaultValue = "30000")
    long timeoutMs;

    void onStart(@Observes StartupEvent ev) {
        ConfigurationChecks.requireHttpUrl("digest.source.url", sourceUrl);
        LOG.infof("Monitoring %s (link selector '%s', body selector '%s')", sourceUrl, linkSelector, bodySelector);
    }

    @Override
    public Uni<ContentItem> fetchLatest() {
        LOG.debugf("Fetching latest item from %s", sourceUrl);
        return fetchPage(sourceUrl)
                .map(this::latestItemUrl)
                .flatMap(itemUrl -> fetchPage(itemUrl)
                        .map(html -> new ContentItem(itemUrl, extractBody(itemUrl, html))))
                .onFailure(t -> !(t instanceof ContentFetchException))
                .transform(t -> new ContentFetchException("Failed to fetch latest item from " + sourceUrl, t));
    }

    private Uni<String> fetchPage(String url) {
        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .map(response -> {
                    if (response.statusCode() / 100 != 2) {
                        throw new ContentFetchException("GET " + url + " returned HTTP " + response.statusCode());
                    }
                    String body = response.bodyAsString();
                    return body != null ? body : "";
                });
    }

    String latestItemUrl(String html) {
        Document page = Jsoup.parse(html, sourceUrl);
        Element link = page.selectFirst(linkSelector);
        if (link == null) {
            throw new ContentFetchException("No element matching '" + linkSelector + "' on " + sourceUrl);
        }
        String url = link.absUrl("href");
        if (url.isEmpty()) {
            url = link.attr("href").trim();
        }
        if (url.isEmpty()) {
            throw new ContentFetchException("Latest item link on " + sourceUrl + " has no href");
        }
        return url;
    }

    String extractBody(String itemUrl, String html) {
        Document post = Jsoup.parse(html, itemUrl);
        Element container = post.selectFirst(bodySelector);
        if (container == null) {
            throw new ContentFetchException("No element matching '" + bodySelector + "' on " + itemUrl);
        }
        String text = container.select("p").stream()
                .map(Element::text)
                .collect(Collectors.joining("\n"));
        if (text.isBlank()) {
            throw new ContentFetchException("Item " + itemUrl + " has no paragraph text");
        }
        LOG.debugf("Extracted %d characters from %s", text.length(), itemUrl);
        return text;
    }
}
