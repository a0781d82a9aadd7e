package sbhackathon.koala.orchestrator.infra.driver;

public class InvalidSpecException extends DriverException {

    public InvalidSpecException(String message) {
        super(message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
