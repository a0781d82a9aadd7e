package sbhackathon.koala.orchestrator.exception;

/**
 * 같은 배포에 대해 이미 다른 작업이 진행 중이거나, 종료 중이라 새 작업을 받을 수 없는 경우.
 */
public class DeploymentBusyException extends RuntimeException {

    public DeploymentBusyException(String message) {
        super(message);
    }

    public DeploymentBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
