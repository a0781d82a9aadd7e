package sbhackathon.koala.orchestrator.infra.driver;

public enum WorkloadPhase {
    RUNNING,
    PROGRESSING,
    STOPPED,
    FAILED,
    MISSING
}
