package sbhackathon.koala.orchestrator.entity;

public enum HealthStatus {
    HEALTHY("정상"),
    DEGRADED("성능저하"),
    UNHEALTHY("비정상"),
    UNKNOWN("알수없음");

    private final String description;

    HealthStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
