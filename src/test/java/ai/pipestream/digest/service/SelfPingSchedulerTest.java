package ai.pipestream.digest.service;

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
 * Tests for SelfPingScheduler against a WireMock stand-in for the public URL.
 */
class SelfPingSchedulerTest {

    private static WireMockServer wireMockServer;
    private static Vertx vertx;
    private static WebClient webClient;

    private SelfPingScheduler scheduler;

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
        scheduler = new SelfPingScheduler();
        scheduler.webClient = webClient;
        scheduler.publicUrl = "http://localhost:" + wireMockServer.port() + "/";
        scheduler.enabled = true;
        scheduler.timeoutMs = 2000;
    }

    @Test
    @DisplayName("Should request the health endpoint of the public URL")
    void testPingSucceeds() {
        wireMockServer.stubFor(get(urlEqualTo("/health"))
                .willReturn(okJson("{\"status\":\"healthy\",\"timestamp\":1}")));
        scheduler.onStart(null);

        scheduler.scheduledPing().await().atMost(Duration.ofSeconds(5));

        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/health")));
        PingState.Snapshot snapshot = scheduler.snapshot();
        assertTrue(snapshot.active());
        assertTrue(snapshot.lastPingSucceeded());
        assertNotNull(snapshot.lastPingAt());
    }

    @Test
    @DisplayName("Should absorb an error status and stay active")
    void testPingErrorStatus() {
        wireMockServer.stubFor(get(urlEqualTo("/health")).willReturn(serverError()));
        scheduler.onStart(null);

        assertDoesNotThrow(() -> scheduler.scheduledPing().await().atMost(Duration.ofSeconds(5)));

        assertTrue(scheduler.snapshot().active());
        assertFalse(scheduler.snapshot().lastPingSucceeded());
    }

    @Test
    @DisplayName("Should absorb a connection failure")
    void testPingConnectionRefused() {
        scheduler.publicUrl = "http://localhost:1";
        scheduler.onStart(null);

        assertDoesNotThrow(() -> scheduler.ping().await().atMost(Duration.ofSeconds(5)));

        assertFalse(scheduler.snapshot().lastPingSucceeded());
        assertNotNull(scheduler.snapshot().lastPingAt());
    }

    @Test
    @DisplayName("Should not ping when disabled")
    void testDisabled() {
        scheduler.enabled = false;
        scheduler.onStart(null);

        scheduler.scheduledPing().await().atMost(Duration.ofSeconds(5));

        assertFalse(scheduler.snapshot().active());
        wireMockServer.verify(0, getRequestedFor(urlEqualTo("/health")));
    }

    @Test
    @DisplayName("Should refuse to start with a malformed public URL")
    void testInvalidUrl() {
        scheduler.publicUrl = "not a url";

        assertThrows(DigestConfigurationException.class, () -> scheduler.onStart(null));
    }
}
