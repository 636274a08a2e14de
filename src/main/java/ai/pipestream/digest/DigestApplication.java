package ai.pipestream.digest;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.jboss.logging.Logger;

/**
 * Main entry point for the Post Digest service.
 * <p>
 * The service is responsible for:
 * <ul>
 *   <li>Polling a publication for its newest post</li>
 *   <li>Summarizing each new post with a remote model</li>
 *   <li>Emailing the summary to the configured recipients</li>
 *   <li>Pinging its own health endpoint so idle hosting keeps it alive</li>
 * </ul>
 * <p>
 * Architecture:
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────┐
 * │                        Post Digest                               │
 * │                                                                  │
 * │  ┌──────────────┐    ┌──────────────┐    ┌──────────────────┐   │
 * │  │   Content    │───>│  Summarizer  │───>│    Notifier      │   │
 * │  │   Source     │    │   (Gemini)   │    │   (Postmark)     │   │
 * │  └──────────────┘    └──────────────┘    └──────────────────┘   │
 * │         ▲                                                        │
 * │         │ every interval                                         │
 * │  ┌──────────────┐    ┌──────────────┐    ┌──────────────────┐   │
 * │  │ DigestWorker │<───│ Control API  │    │    Self-Ping     │   │
 * │  │   (loop)     │    │ / start stop │    │  (scheduler)     │   │
 * │  └──────────────┘    └──────────────┘    └──────────────────┘   │
 * └──────────────────────────────────────────────────────────────────┘
 * </pre>
 */
@QuarkusMain
public class DigestApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(DigestApplication.class);

    /**
     * Default constructor for DigestApplication.
     */
    public DigestApplication() {
    }

    /**
     * Main entry point for the Quarkus application.
     *
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        Quarkus.run(DigestApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Starting Pipestream Post Digest");
        LOG.info("Responsibilities: source polling, summarization, email delivery, self-ping");
        Quarkus.waitForExit();
        return 0;
    }
}
