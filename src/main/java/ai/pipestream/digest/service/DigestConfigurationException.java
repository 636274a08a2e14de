package ai.pipestream.digest.service;

/**
 * Raised during startup when required configuration is missing or malformed.
 * The process refuses to start.
 */
public class DigestConfigurationException extends RuntimeException {

    public DigestConfigurationException(String message) {
        super(message);
    }

    public DigestConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
