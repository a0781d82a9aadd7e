package sbhackathon.koala.orchestrator.infra.driver;

public class WorkloadNotFoundException extends DriverException {

    public WorkloadNotFoundException(String handle) {
        super("Workload not found: " + handle);
    }

    public WorkloadNotFoundException(String handle, Throwable cause) {
        super("Workload not found: " + handle, cause);
    }
}
