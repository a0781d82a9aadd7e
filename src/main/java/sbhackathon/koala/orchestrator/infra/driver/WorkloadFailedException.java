package sbhackathon.koala.orchestrator.infra.driver;

/**
 * The backend reports the workload itself as failed (crash loop, exceeded progress deadline).
 */
public class WorkloadFailedException extends DriverException {

    public WorkloadFailedException(String message) {
        super(message);
    }
}
