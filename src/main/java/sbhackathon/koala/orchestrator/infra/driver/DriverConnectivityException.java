package sbhackathon.koala.orchestrator.infra.driver;

/**
 * The backend (Docker daemon, Kubernetes API server) could not be reached.
 */
public class DriverConnectivityException extends DriverException {

    public DriverConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
