package ai.pipestream.digest.service;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

/**
 * Startup validation of configuration values that SmallRye Config cannot check by type alone.
 */
public final class ConfigurationChecks {

    private ConfigurationChecks() {
    }

    /**
     * Ensures the value is an absolute http or https URL.
     *
     * @param property property name, for the error message
     * @param value configured value
     * @throws DigestConfigurationException if the value is not an absolute http(s) URL
     */
    public static void requireHttpUrl(String property, String value) {
        URI uri;
        try {
            uri = URI.create(value == null ? "" : value.trim());
        } catch (IllegalArgumentException e) {
            throw new DigestConfigurationException(property + " is not a valid URL: " + value, e);
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new DigestConfigurationException(property + " must be an absolute http(s) URL: " + value);
        }
    }

    /**
     * Splits a comma-separated recipient list, dropping blanks.
     *
     * @param property property name, for the error message
     * @param value configured value
     * @return the trimmed addresses in configured order
     * @throws DigestConfigurationException if no address remains
     */
    public static List<String> parseRecipients(String property, String value) {
        List<String> recipients = value == null ? List.of() : Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(address -> !address.isEmpty())
                .toList();
        if (recipients.isEmpty()) {
            throw new DigestConfigurationException(property + " must list at least one address");
        }
        for (String address : recipients) {
            if (address.indexOf('@') <= 0 || address.endsWith("@")) {
                throw new DigestConfigurationException(property + " contains an invalid address: " + address);
            }
        }
        return recipients;
    }
}
