package sbhackathon.koala.orchestrator.monitor;

/**
 * 한 번의 헬스 체크 결과로 감시를 계속할지 여부.
 */
public enum ReconcileOutcome {
    CONTINUE,
    STOP_WATCHING
}
