package sbhackathon.koala.orchestrator.service.lifecycle;

import lombok.Getter;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;

@Getter
public class RetriesExhaustedException extends DriverException {

    private final int retries;

    public RetriesExhaustedException(String action, int retries, DriverException lastFailure) {
        super(String.format("%s failed after %d retries: %s", action, retries, lastFailure.getMessage()), lastFailure);
        this.retries = retries;
    }
}
