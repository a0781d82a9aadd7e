package sbhackathon.koala.orchestrator.service.task;

/**
 * 배포 id 의 lease 를 점유하는 작업 종류.
 */
public enum OperationType {
    DEPLOY(true),
    START(true),
    SCALE(true),
    UPDATE(true),
    RECOVER(true),
    STOP(true),
    DELETE(false),
    RECONCILE(false);

    private final boolean cancellable;

    OperationType(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * stop/delete 요청이 이 작업을 중단시킬 수 있는지 여부. STOP 작업은 DELETE 요청으로만 중단됩니다.
     */
    public boolean isCancellableBy(PendingIntent intent) {
        if (this == STOP) {
            return intent == PendingIntent.DELETE;
        }
        return cancellable;
    }
}
