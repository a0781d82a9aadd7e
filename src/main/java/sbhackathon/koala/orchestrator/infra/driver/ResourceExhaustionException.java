package sbhackathon.koala.orchestrator.infra.driver;

/**
 * The backend lacks capacity (quota exceeded, out of memory or disk). Fatal until
 * capacity changes outside of this service.
 */
public class ResourceExhaustionException extends DriverException {

    public ResourceExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
