package sbhackathon.koala.orchestrator.service.task;

/**
 * 진행 중인 작업을 중단시킨 요청. 작업은 다음 checkpoint 에서 이 의도에 맞는 정리 경로로 전환합니다.
 */
public enum PendingIntent {
    STOP,
    DELETE;

    PendingIntent merge(PendingIntent other) {
        if (other == null) {
            return this;
        }
        return this == DELETE || other == DELETE ? DELETE : STOP;
    }
}
