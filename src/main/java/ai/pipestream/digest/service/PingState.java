package ai.pipestream.digest.service;

import java.time.Instant;

/**
 * Activation flag and last result of the self-ping task. Independent of {@link WorkerState}.
 */
public final class PingState {

    /**
     * @param active whether the self-ping task runs
     * @param lastPingAt when the last ping finished, or null
     * @param lastPingSucceeded whether the last ping got a 2xx answer
     */
    public record Snapshot(boolean active, Instant lastPingAt, boolean lastPingSucceeded) {
    }

    private boolean active;
    private Instant lastPingAt;
    private boolean lastPingSucceeded;

    synchronized void activate(boolean active) {
        this.active = active;
    }

    synchronized boolean isActive() {
        return active;
    }

    synchronized void recordPing(boolean succeeded, Instant at) {
        this.lastPingSucceeded = succeeded;
        this.lastPingAt = at;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(active, lastPingAt, lastPingSucceeded);
    }
}
