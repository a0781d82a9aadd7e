package sbhackathon.koala.orchestrator.exception;

public class DeploymentNotFoundException extends RuntimeException {

    public DeploymentNotFoundException(String deploymentId) {
        super("Deployment not found with id: " + deploymentId);
    }
}
