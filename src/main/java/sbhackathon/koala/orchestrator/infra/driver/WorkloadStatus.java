package sbhackathon.koala.orchestrator.infra.driver;

/**
 * Point-in-time observation of a workload on its backend.
 */
public record WorkloadStatus(
        WorkloadPhase phase,
        int replicasDesired,
        int replicasReady,
        String message,
        String endpointUrl
) {
    public static WorkloadStatus missing(String handle) {
        return new WorkloadStatus(WorkloadPhase.MISSING, 0, 0, "No backend object found for " + handle, null);
    }

    public boolean exists() {
        return phase != WorkloadPhase.MISSING;
    }

    public boolean isReady(int expectedReplicas) {
        return phase != WorkloadPhase.MISSING && phase != WorkloadPhase.FAILED
                && replicasReady >= expectedReplicas;
    }
}
