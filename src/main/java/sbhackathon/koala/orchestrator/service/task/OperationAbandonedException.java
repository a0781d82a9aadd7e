package sbhackathon.koala.orchestrator.service.task;

/**
 * 종료 중 인터럽트된 작업. 더 이상 기록을 쓰지 않으며, 마지막으로 저장된 중간 상태는 헬스 모니터가 복구합니다.
 */
public class OperationAbandonedException extends RuntimeException {

    public OperationAbandonedException(String deploymentId, Throwable cause) {
        super("Operation on deployment " + deploymentId + " abandoned", cause);
    }
}
