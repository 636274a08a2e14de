package ai.pipestream.digest.service;

import ai.pipestream.digest.model.CycleOutcome;

import java.time.Instant;

/**
 * Lifecycle phase and last-seen marker of the polling loop.
 * <p>
 * Owned by {@link DigestWorker}. Every read and transition holds this object's
 * monitor, so a transition always re-checks the phase it starts from.
 */
public final class WorkerState {

    /**
     * Lifecycle phase of the polling loop.
     */
    public enum Phase {
        /** No loop instance exists */
        STOPPED,
        /** Exactly one loop instance is cycling */
        RUNNING,
        /** The loop will exit at its next cycle or sleep boundary */
        STOP_REQUESTED
    }

    /**
     * Point-in-time copy of the state.
     *
     * @param phase current lifecycle phase
     * @param lastProcessedId last identifier confirmed delivered, or null
     * @param cycleCount cycles completed since the process started
     * @param lastOutcome how the most recent cycle ended, or null before the first cycle
     * @param lastCycleAt when the most recent cycle ended, or null before the first cycle
     */
    public record Snapshot(Phase phase, String lastProcessedId, long cycleCount,
                           CycleOutcome.Kind lastOutcome, Instant lastCycleAt) {

        public boolean running() {
            return phase != Phase.STOPPED;
        }

        public boolean stopRequested() {
            return phase == Phase.STOP_REQUESTED;
        }
    }

    private Phase phase = Phase.STOPPED;
    private String lastProcessedId;
    private long cycleCount;
    private CycleOutcome.Kind lastOutcome;
    private Instant lastCycleAt;

    /**
     * {@code STOPPED -> RUNNING}.
     *
     * @return true if this call made the transition, false if a loop already exists
     */
    synchronized boolean tryStart() {
        if (phase != Phase.STOPPED) {
            return false;
        }
        phase = Phase.RUNNING;
        return true;
    }

    /**
     * {@code RUNNING -> STOP_REQUESTED}. Repeating the request while one is pending is harmless.
     *
     * @return false if no loop exists
     */
    synchronized boolean requestStop() {
        if (phase == Phase.STOPPED) {
            return false;
        }
        phase = Phase.STOP_REQUESTED;
        return true;
    }

    /**
     * Boundary check made by the loop itself; honors a pending stop request by
     * moving to {@code STOPPED}.
     *
     * @return true if the loop should carry on
     */
    synchronized boolean continueOrStop() {
        if (phase == Phase.STOP_REQUESTED) {
            phase = Phase.STOPPED;
            return false;
        }
        return phase == Phase.RUNNING;
    }

    synchronized boolean isStopRequested() {
        return phase == Phase.STOP_REQUESTED;
    }

    synchronized String lastProcessedId() {
        return lastProcessedId;
    }

    /**
     * Seeds the marker from the durable store before the first cycle.
     */
    synchronized void restoreLastProcessedId(String identifier) {
        this.lastProcessedId = identifier;
    }

    /**
     * Counts a finished cycle. Only a delivered outcome moves the marker.
     */
    synchronized void recordCycle(CycleOutcome outcome, Instant at) {
        cycleCount++;
        lastOutcome = outcome.kind();
        lastCycleAt = at;
        if (outcome.kind() == CycleOutcome.Kind.DELIVERED) {
            lastProcessedId = outcome.newId();
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(phase, lastProcessedId, cycleCount, lastOutcome, lastCycleAt);
    }
}
