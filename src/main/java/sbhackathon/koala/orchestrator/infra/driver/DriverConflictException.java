package sbhackathon.koala.orchestrator.infra.driver;

/**
 * An object with the same logical name already exists. Drivers resolve this by
 * adopting the existing object; it never leaves {@link ContainerDriver#create}.
 */
public class DriverConflictException extends DriverException {

    public DriverConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
