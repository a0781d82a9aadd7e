package sbhackathon.koala.orchestrator.infra.driver;

public class DriverTimeoutException extends DriverException {

    public DriverTimeoutException(String message) {
        super(message);
    }

    public DriverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
