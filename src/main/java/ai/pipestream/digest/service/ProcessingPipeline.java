package ai.pipestream.digest.service;

import ai.pipestream.digest.client.ContentFetchException;
import ai.pipestream.digest.client.ContentSourceClient;
import ai.pipestream.digest.client.CycleStageException;
import ai.pipestream.digest.client.DeliveryException;
import ai.pipestream.digest.client.NotifierClient;
import ai.pipestream.digest.client.SummarizationException;
import ai.pipestream.digest.client.SummarizerClient;
import ai.pipestream.digest.model.ContentItem;
import ai.pipestream.digest.model.CycleOutcome;
import ai.pipestream.digest.model.PipelineStage;
import ai.pipestream.digest.model.Summary;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;

/**
 * One cycle of work: fetch, detect change, summarize, deliver.
 * <p>
 * Flow: Fetch latest item → compare with previous id → Summarize → Notify → report new id
 * <p>
 * The returned {@link Uni} never fails. Stage failures become a {@link CycleOutcome.Kind#FAILED}
 * outcome so the worker can retry on its next tick without classifying errors itself.
 * The new identifier is only reported after the notifier confirmed delivery.
 */
@ApplicationScoped
public class ProcessingPipeline {

    private static final Logger LOG = Logger.getLogger(ProcessingPipeline.class);

    @Inject
    ContentSourceClient contentSource;

    @Inject
    SummarizerClient summarizer;

    @Inject
    NotifierClient notifier;

    @ConfigProperty(name = "digest.notifier.recipients")
    String recipientList;

    private volatile List<String> recipients;

    void onStart(@Observes StartupEvent ev) {
        LOG.infof("Summaries go to %d recipient(s)", recipients().size());
    }

    /**
     * Runs one cycle.
     *
     * @param previousId identifier of the last delivered item, or null if none
     * @return a Uni resolving to the cycle outcome
     */
    public Uni<CycleOutcome> process(String previousId) {
        return Uni.createFrom().deferred(contentSource::fetchLatest)
                .onFailure().transform(t -> asStageFailure(t, PipelineStage.FETCH))
                .flatMap(item -> {
                    if (item == null || item.identifier() == null || item.identifier().isBlank()) {
                        return Uni.createFrom().failure(
                                new ContentFetchException("Source returned an item without identifier"));
                    }
                    if (item.identifier().equals(previousId)) {
                        LOG.debugf("No new content; latest item is still %s", previousId);
                        return Uni.createFrom().item(CycleOutcome.noChange(item.identifier()));
                    }
                    LOG.infof("New item found: %s", item.identifier());
                    return summarizeAndDeliver(item);
                })
                .onFailure().recoverWithItem(t -> {
                    PipelineStage stage = t instanceof CycleStageException cse ? cse.stage() : PipelineStage.FETCH;
                    LOG.errorf(t, "Cycle failed at stage %s; will retry next interval", stage);
                    return CycleOutcome.failed(stage, null, t);
                });
    }

    private Uni<CycleOutcome> summarizeAndDeliver(ContentItem item) {
        String identifier = item.identifier();
        return Uni.createFrom().deferred(() -> summarizer.summarize(item))
                .map(summary -> requireText(summary, identifier))
                .onFailure().transform(t -> asStageFailure(t, PipelineStage.SUMMARIZE))
                .flatMap(summary -> Uni.createFrom().deferred(() -> notifier.send(summary, recipients()))
                        .onFailure().transform(t -> asStageFailure(t, PipelineStage.DELIVER)))
                .map(ignored -> CycleOutcome.delivered(identifier))
                .onFailure().recoverWithItem(t -> {
                    PipelineStage stage = ((CycleStageException) t).stage();
                    LOG.errorf(t, "Cycle failed at stage %s for item %s; will retry next interval", stage, identifier);
                    return CycleOutcome.failed(stage, identifier, t);
                });
    }

    private static Summary requireText(Summary summary, String identifier) {
        if (summary == null || summary.text() == null || summary.text().isBlank()) {
            throw new SummarizationException("Summarizer returned empty text for " + identifier);
        }
        return summary;
    }

    private static Throwable asStageFailure(Throwable t, PipelineStage stage) {
        if (t instanceof CycleStageException) {
            return t;
        }
        String message = Objects.requireNonNullElse(t.getMessage(), t.getClass().getName());
        return switch (stage) {
            case FETCH -> new ContentFetchException(message, t);
            case SUMMARIZE -> new SummarizationException(message, t);
            case DELIVER, PERSIST -> new DeliveryException(message, t);
        };
    }

    /**
     * @return the configured recipients, parsed once
     * @throws DigestConfigurationException if the list holds no valid address
     */
    public List<String> recipients() {
        List<String> parsed = recipients;
        if (parsed == null) {
            parsed = ConfigurationChecks.parseRecipients("digest.notifier.recipients", recipientList);
            recipients = parsed;
        }
        return parsed;
    }
}
