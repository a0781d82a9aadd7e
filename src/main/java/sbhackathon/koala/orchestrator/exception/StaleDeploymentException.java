package sbhackathon.koala.orchestrator.exception;

/**
 * version 검사에 실패한 쓰기. 다른 writer가 먼저 같은 row를 갱신했습니다.
 */
public class StaleDeploymentException extends RuntimeException {

    public StaleDeploymentException(String deploymentId, Throwable cause) {
        super("Deployment " + deploymentId + " was modified concurrently", cause);
    }
}
