package sbhackathon.koala.orchestrator.exception;

import lombok.Getter;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;

@Getter
public class IllegalStateTransitionException extends RuntimeException {

    private final DeploymentStatus from;
    private final String event;

    public IllegalStateTransitionException(DeploymentStatus from, String event) {
        super(String.format("Cannot apply %s to a deployment in state %s", event, from));
        this.from = from;
        this.event = event;
    }
}
