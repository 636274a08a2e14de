package ai.pipestream.digest.api;

import ai.pipestream.digest.service.DigestWorker;
import ai.pipestream.digest.service.SelfPingScheduler;
import ai.pipestream.digest.service.WorkerState;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Status and lifecycle control over HTTP.
 * <p>
 * Handlers only read snapshots or request transitions from {@link DigestWorker}; they
 * never run pipeline work and never wait for a cycle. Starting a running worker or
 * stopping a stopped one is reported in the status text, not as an error.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class DigestControlResource {

    private static final Logger LOG = Logger.getLogger(DigestControlResource.class);

    static final String WORKER_STARTED = "worker started";
    static final String WORKER_ALREADY_RUNNING = "worker already running";
    static final String WORKER_STOPPING = "worker stopping - will finish current cycle";
    static final String WORKER_NOT_RUNNING = "worker not running";

    @Inject
    DigestWorker worker;

    @Inject
    SelfPingScheduler selfPing;

    Clock clock = Clock.systemUTC();

    @GET
    public StatusResponse status() {
        WorkerState.Snapshot snapshot = worker.snapshot();
        return new StatusResponse(
                "running",
                snapshot.running(),
                selfPing.snapshot().active(),
                snapshot.lastProcessedId(),
                snapshot.cycleCount(),
                snapshot.lastOutcome() != null ? snapshot.lastOutcome().name() : null);
    }

    @GET
    @Path("health")
    public HealthResponse health() {
        return new HealthResponse("healthy", clock.instant().getEpochSecond());
    }

    @POST
    @Path("start")
    public ControlResponse start() {
        LOG.info("Received request to start the worker");
        return switch (worker.start()) {
            case STARTED -> new ControlResponse(WORKER_STARTED);
            case ALREADY_RUNNING -> new ControlResponse(WORKER_ALREADY_RUNNING);
        };
    }

    @POST
    @Path("stop")
    public ControlResponse stop() {
        LOG.info("Received request to stop the worker");
        return switch (worker.stop()) {
            case STOPPING -> new ControlResponse(WORKER_STOPPING);
            case NOT_RUNNING -> new ControlResponse(WORKER_NOT_RUNNING);
        };
    }
}
