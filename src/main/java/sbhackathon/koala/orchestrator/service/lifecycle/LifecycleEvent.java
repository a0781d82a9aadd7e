package sbhackathon.koala.orchestrator.service.lifecycle;

public enum LifecycleEvent {
    SUBMIT,
    SUCCEED,
    FAIL,
    SCALE,
    UPDATE,
    STOP,
    START,
    RESUBMIT,
    RECOVERY_EXHAUSTED,
    CANCEL,
    DELETE
}
