package ai.pipestream.digest.service;

import ai.pipestream.digest.model.CycleOutcome;
import ai.pipestream.digest.model.PipelineStage;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the polling loop and its lifecycle.
 * <p>
 * The loop is a chain of Vert.x timers rather than a dedicated thread:
 * <pre>
 *   check ─▶ pipeline cycle ─▶ record outcome ─▶ check ─▶ sleep (timer) ─┐
 *     ▲                                                                  │
 *     └──────────────────────────────────────────────────────────────────┘
 * </pre>
 * Each "check" honors a pending stop request by moving the state to {@code STOPPED}
 * and ending the chain. A stop during the sleep cancels the timer and runs the
 * post-sleep check immediately; a stop during a cycle never interrupts it.
 * Only a {@code STOPPED -> RUNNING} transition creates a chain, and only the chain
 * itself moves back to {@code STOPPED}, so at most one loop is active at any time.
 */
@ApplicationScoped
public class DigestWorker {

    private static final Logger LOG = Logger.getLogger(DigestWorker.class);

    /**
     * Answer to a start request.
     */
    public enum StartResult {
        /** A new loop was created */
        STARTED,
        /** A loop already exists, possibly finishing after a stop request */
        ALREADY_RUNNING
    }

    /**
     * Answer to a stop request.
     */
    public enum StopResult {
        /** The loop will exit at its next boundary */
        STOPPING,
        /** No loop exists */
        NOT_RUNNING
    }

    @Inject
    Vertx vertx;

    @Inject
    ProcessingPipeline pipeline;

    @Inject
    LastSeenStore lastSeenStore;

    @ConfigProperty(name = "digest.worker.interval", defaultValue = "3600")
    Duration interval;

    @ConfigProperty(name = "digest.worker.autostart", defaultValue = "true")
    boolean autostart;

    @ConfigProperty(name = "digest.worker.restore-timeout", defaultValue = "10s")
    Duration restoreTimeout;

    Clock clock = Clock.systemUTC();

    private final WorkerState state = new WorkerState();

    /** Guards {@link #sleepTimerId}; never held while touching {@link #state} */
    private final Object sleepLock = new Object();

    /** Timer of the current sleep, or -1 while a cycle runs or no loop exists */
    private long sleepTimerId = -1;

    void onStart(@Observes StartupEvent ev) {
        restoreMarker();
        if (autostart) {
            start();
        } else {
            LOG.info("digest.worker.autostart=false; waiting for an explicit start request");
        }
    }

    void onStop(@Observes ShutdownEvent ev) {
        if (stop() == StopResult.STOPPING) {
            LOG.info("Shutdown requested while the worker was running");
        }
    }

    /**
     * Loads the marker from the durable store so a restart does not re-notify the latest item.
     */
    void restoreMarker() {
        Optional<String> stored = lastSeenStore.load().await().atMost(restoreTimeout);
        stored.ifPresent(identifier -> {
            state.restoreLastProcessedId(identifier);
            LOG.infof("Restored last processed item %s", identifier);
        });
    }

    /**
     * Starts the polling loop unless one already exists.
     * <p>
     * Safe to call from any thread at any frequency.
     *
     * @return whether a new loop was created
     */
    public StartResult start() {
        if (!state.tryStart()) {
            LOG.debug("Start requested but the worker is already running");
            return StartResult.ALREADY_RUNNING;
        }
        LOG.infof("Worker started; polling every %s", interval);
        vertx.runOnContext(this::runCycle);
        return StartResult.STARTED;
    }

    /**
     * Asks the loop to exit. Returns immediately; an in-flight cycle is allowed to finish.
     *
     * @return whether a loop was running
     */
    public StopResult stop() {
        if (!state.requestStop()) {
            LOG.debug("Stop requested but the worker is not running");
            return StopResult.NOT_RUNNING;
        }
        LOG.info("Stop requested; worker will finish its current cycle");
        interruptSleep();
        return StopResult.STOPPING;
    }

    /**
     * @return a consistent copy of the worker state; never waits for an in-flight cycle
     */
    public WorkerState.Snapshot snapshot() {
        return state.snapshot();
    }

    private void runCycle() {
        if (!state.continueOrStop()) {
            LOG.info("Worker stopped");
            return;
        }
        String previousId = state.lastProcessedId();
        Uni.createFrom().deferred(() -> pipeline.process(previousId))
                .flatMap(this::recordOutcome)
                .subscribe().with(
                        ignored -> sleepThenContinue(),
                        failure -> {
                            LOG.errorf(failure, "Cycle ended with an unexpected error; will retry next interval");
                            sleepThenContinue();
                        });
    }

    private Uni<Void> recordOutcome(CycleOutcome outcome) {
        state.recordCycle(outcome, Instant.now(clock));
        switch (outcome.kind()) {
            case DELIVERED -> LOG.infof("Delivered summary of %s", outcome.newId());
            case NO_CHANGE -> LOG.info("No new content");
            case FAILED -> LOG.warnf("Cycle failed at stage %s; last processed item stays %s",
                    outcome.failedStage(), state.lastProcessedId());
        }
        if (outcome.kind() != CycleOutcome.Kind.DELIVERED) {
            return Uni.createFrom().voidItem();
        }
        String identifier = outcome.newId();
        return Uni.createFrom().deferred(() -> lastSeenStore.save(identifier))
                .onFailure().invoke(error -> LOG.errorf(error,
                        "Cycle stage %s failed: could not store marker %s; it is kept in memory",
                        PipelineStage.PERSIST, identifier))
                .onFailure().recoverWithNull();
    }

    private void sleepThenContinue() {
        if (!state.continueOrStop()) {
            LOG.info("Worker stopped after finishing its cycle");
            return;
        }
        long delay = Math.max(1, interval.toMillis());
        synchronized (sleepLock) {
            sleepTimerId = vertx.setTimer(delay, id -> endSleep());
        }
        // a stop that landed between the check and the timer would otherwise wait out the full interval
        if (state.isStopRequested()) {
            interruptSleep();
        }
    }

    private void endSleep() {
        synchronized (sleepLock) {
            sleepTimerId = -1;
        }
        runCycle();
    }

    private void interruptSleep() {
        long timerId;
        synchronized (sleepLock) {
            timerId = sleepTimerId;
            sleepTimerId = -1;
        }
        if (timerId >= 0 && vertx.cancelTimer(timerId)) {
            LOG.debug("Sleep interrupted by stop request");
            vertx.runOnContext(this::runCycle);
        }
    }
}
