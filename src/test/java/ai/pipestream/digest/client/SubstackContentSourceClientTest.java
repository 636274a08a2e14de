package ai.pipestream.digest.client;

import ai.pipestream.digest.model.ContentItem;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SubstackContentSourceClient against WireMock-served pages.
 */
class SubstackContentSourceClientTest {

    private static final String ARCHIVE_HTML = """
            <html><body>
              <nav><a class="nav-link" href="/about">About</a></nav>
              <ul>
                <li><a class="sitemap-link" href="/p/newest-post">Newest post</a></li>
                <li><a class="sitemap-link" href="/p/older-post">Older post</a></li>
              </ul>
            </body></html>
            """;

    private static final String POST_HTML = """
            <html><body>
              <h1>Newest post</h1>
              <div class="body markup">
                <p>First paragraph.</p>
                <p>Second   paragraph with <em>emphasis</em>.</p>
              </div>
              <footer><p>Subscribe now</p></footer>
            </body></html>
            """;

    private static WireMockServer wireMockServer;
    private static Vertx vertx;
    private static WebClient webClient;

    private SubstackContentSourceClient client;

    @BeforeAll
    static void startServer() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        vertx = Vertx.vertx();
        webClient = WebClient.create(vertx);
    }

    @AfterAll
    static void stopServer() {
        webClient.close();
        vertx.closeAndAwait();
        wireMockServer.stop();
    }

    @BeforeEach
    void setUp() {
        wireMockServer.resetAll();
        client = new SubstackContentSourceClient();
        client.webClient = webClient;
        client.sourceUrl = baseUrl() + "/sitemap";
        client.linkSelector = "a.sitemap-link";
        client.bodySelector = "div.body";
        client.timeoutMs = 2000;
    }

    private static String baseUrl() {
        return "http://localhost:" + wireMockServer.port();
    }

    private ContentItem fetch() {
        return client.fetchLatest().await().atMost(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should resolve the newest post link and extract its paragraphs")
    void testFetchLatest() {
        wireMockServer.stubFor(get(urlEqualTo("/sitemap")).willReturn(ok(ARCHIVE_HTML)));
        wireMockServer.stubFor(get(urlEqualTo("/p/newest-post")).willReturn(ok(POST_HTML)));

        ContentItem item = fetch();

        assertEquals(baseUrl() + "/p/newest-post", item.identifier());
        assertEquals("First paragraph.\nSecond paragraph with emphasis.", item.body());
        wireMockServer.verify(0, getRequestedFor(urlEqualTo("/p/older-post")));
    }

    @Test
    @DisplayName("Should fail when the source page has no matching link")
    void testNoLink() {
        wireMockServer.stubFor(get(urlEqualTo("/sitemap")).willReturn(ok("<html><body>empty</body></html>")));

        ContentFetchException error = assertThrows(ContentFetchException.class, this::fetch);
        assertTrue(error.getMessage().contains("a.sitemap-link"));
    }

    @Test
    @DisplayName("Should fail when the post has no body container")
    void testNoBody() {
        wireMockServer.stubFor(get(urlEqualTo("/sitemap")).willReturn(ok(ARCHIVE_HTML)));
        wireMockServer.stubFor(get(urlEqualTo("/p/newest-post"))
                .willReturn(ok("<html><body><p>No container</p></body></html>")));

        assertThrows(ContentFetchException.class, this::fetch);
    }

    @Test
    @DisplayName("Should fail when the body container has no paragraph text")
    void testEmptyBody() {
        wireMockServer.stubFor(get(urlEqualTo("/sitemap")).willReturn(ok(ARCHIVE_HTML)));
        wireMockServer.stubFor(get(urlEqualTo("/p/newest-post"))
                .willReturn(ok("<html><body><div class=\"body\"><img src=\"x.png\"></div></body></html>")));

        assertThrows(ContentFetchException.class, this::fetch);
    }

    @Test
    @DisplayName("Should fail on an error status from the source")
    void testErrorStatus() {
        wireMockServer.stubFor(get(urlEqualTo("/sitemap")).willReturn(serviceUnavailable()));

        ContentFetchException error = assertThrows(ContentFetchException.class, this::fetch);
        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    @DisplayName("Should wrap transport errors as fetch failures")
    void testConnectionRefused() {
        client.sourceUrl = "http://localhost:1/sitemap";

        ContentFetchException error = assertThrows(ContentFetchException.class, this::fetch);
        assertNotNull(error.getCause());
    }

    @Test
    @DisplayName("Should time out a source that never answers")
    void testTimeout() {
        client.timeoutMs = 200;
        wireMockServer.stubFor(get(urlEqualTo("/sitemap"))
                .willReturn(ok(ARCHIVE_HTML).withFixedDelay(2000)));

        assertThrows(ContentFetchException.class, this::fetch);
    }
}
