package ai.pipestream.digest;

import ai.pipestream.digest.service.DigestWorker;
import ai.pipestream.digest.service.WorkerState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check for the digest service.
 * <p>
 * Always up while the process answers; a stopped worker is a valid state, not a failure.
 * The worker snapshot is attached as check data.
 */
@ApplicationScoped
@Liveness
public class DigestHealthCheck implements HealthCheck {

    @Inject
    DigestWorker worker;

    @Override
    public HealthCheckResponse call() {
        WorkerState.Snapshot snapshot = worker.snapshot();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("post-digest")
                .up()
                .withData("worker", snapshot.phase().name())
                .withData("cycles", snapshot.cycleCount());
        if (snapshot.lastProcessedId() != null) {
            builder.withData("lastProcessed", snapshot.lastProcessedId());
        }
        if (snapshot.lastOutcome() != null) {
            builder.withData("lastOutcome", snapshot.lastOutcome().name());
        }
        return builder.build();
    }
}
