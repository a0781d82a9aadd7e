package sbhackathon.koala.orchestrator.infra.driver;

/**
 * Base type for every failure raised by a {@link ContainerDriver}.
 * <p>
 * Subclasses decide whether the lifecycle layer may retry the call. A plain
 * {@code DriverException} is a backend failure that retrying will not fix.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
