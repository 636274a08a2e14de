package ai.pipestream.digest.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigurationChecks.
 */
class ConfigurationChecksTest {

    @Test
    @DisplayName("Should split and trim a comma-separated recipient list")
    void testParseRecipients() {
        List<String> recipients = ConfigurationChecks.parseRecipients("r",
                " a@example.com,b@example.com ,, c@example.org ");

        assertEquals(List.of("a@example.com", "b@example.com", "c@example.org"), recipients);
    }

    @Test
    @DisplayName("Should reject an empty recipient list")
    void testEmptyRecipients() {
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.parseRecipients("r", ""));
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.parseRecipients("r", " , "));
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.parseRecipients("r", null));
    }

    @Test
    @DisplayName("Should reject a recipient that is not an address")
    void testInvalidRecipient() {
        DigestConfigurationException error = assertThrows(DigestConfigurationException.class,
                () -> ConfigurationChecks.parseRecipients("digest.notifier.recipients", "a@example.com,nobody"));

        assertTrue(error.getMessage().contains("nobody"));
        assertTrue(error.getMessage().contains("digest.notifier.recipients"));
    }

    @Test
    @DisplayName("Should accept absolute http and https URLs")
    void testValidUrls() {
        assertDoesNotThrow(() -> ConfigurationChecks.requireHttpUrl("u", "https://example.substack.com"));
        assertDoesNotThrow(() -> ConfigurationChecks.requireHttpUrl("u", "http://localhost:8080/"));
    }

    @Test
    @DisplayName("Should reject relative, non-http and malformed URLs")
    void testInvalidUrls() {
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.requireHttpUrl("u", "/relative"));
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.requireHttpUrl("u", "ftp://host/x"));
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.requireHttpUrl("u", "http://bad host"));
        assertThrows(DigestConfigurationException.class, () -> ConfigurationChecks.requireHttpUrl("u", null));
    }
}
