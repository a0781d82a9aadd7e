package sbhackathon.koala.orchestrator.infra.driver;

import sbhackathon.koala.orchestrator.entity.BackendType;

import java.util.function.Consumer;

/**
 * Uniform capability set over a container backend.
 * <p>
 * Implementations only talk to infrastructure; they never read or write deployment
 * records. Every method may block on network I/O and reports failures through the
 * {@link DriverException} hierarchy:
 * <ul>
 *     <li>{@link DriverConnectivityException} / {@link DriverTimeoutException} are retryable,</li>
 *     <li>{@link InvalidSpecException}, {@link ResourceExhaustionException},
 *     {@link WorkloadNotFoundException} and {@link WorkloadFailedException} are fatal,</li>
 *     <li>{@link DriverConflictException} is resolved inside {@link #create} by adoption.</li>
 * </ul>
 */
public interface ContainerDriver {

    BackendType backendType();

    /**
     * Creates the workload without starting it. Idempotent by {@link WorkloadSpec#name()}:
     * when an object with that name already exists it is adopted and its handle returned.
     *
     * @return opaque handle identifying the workload on this backend
     */
    String create(WorkloadSpec spec);

    void start(String handle);

    void stop(String handle);

    void scale(String handle, int replicas);

    /**
     * Rolls an existing workload to a new spec (image, environment, limits, probe path).
     */
    void update(String handle, WorkloadSpec spec);

    /**
     * Removes every backend object behind the handle. Deleting an absent workload is a no-op.
     */
    void delete(String handle);

    WorkloadStatus getStatus(String handle);

    /**
     * Pushes the last {@code tailLines} log lines of every replica to {@code sink}.
     */
    void streamLogs(String handle, int tailLines, Consumer<String> sink);

    /**
     * Handle a workload created from a spec with the given name would have. Both backends key
     * objects by logical name, so a record that never persisted its handle can still be
     * observed and torn down.
     */
    default String handleFor(String workloadName) {
        return workloadName;
    }
}
