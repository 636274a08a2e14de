package ai.pipestream.digest.client;

import ai.pipestream.digest.model.Summary;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Delivers a summary to a set of recipients.
 */
public interface NotifierClient {

    /**
     * Sends the summary.
     *
     * @param summary the summary to deliver
     * @param recipients recipient addresses, never empty
     * @return a Uni completing once the provider confirmed delivery, or failing with {@link DeliveryException}
     */
    Uni<Void> send(Summary summary, List<String> recipients);
}
