package sbhackathon.koala.orchestrator.service.task;

import lombok.Getter;

/**
 * 진행 중인 작업이 checkpoint 에서 취소 요청을 발견했습니다.
 */
@Getter
public class OperationCancelledException extends RuntimeException {

    private final String deploymentId;
    private final PendingIntent intent;

    public OperationCancelledException(String deploymentId, PendingIntent intent) {
        super("Operation on deployment " + deploymentId + " cancelled by " + intent + " request");
        this.deploymentId = deploymentId;
        this.intent = intent;
    }
}
