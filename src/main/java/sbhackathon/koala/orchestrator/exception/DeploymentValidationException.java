package sbhackathon.koala.orchestrator.exception;

/**
 * 잘못된 배포 요청 (replica 범위 초과, 필수 값 누락 등). 재시도하지 않고 호출자에게 바로 반환됩니다.
 */
public class DeploymentValidationException extends RuntimeException {

    public DeploymentValidationException(String message) {
        super(message);
    }

    public DeploymentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
