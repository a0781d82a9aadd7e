package sbhackathon.koala.orchestrator.entity;

public enum DeploymentStatus {
    PENDING("대기중"),
    DEPLOYING("배포중"),
    RUNNING("실행중"),
    SCALING("스케일링중"),
    UPDATING("업데이트중"),
    STOPPING("중지중"),
    STOPPED("중지됨"),
    FAILED("실패"),
    ERROR("오류");

    private final String description;

    DeploymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 작업이 진행 중인 중간 상태인지 확인합니다.
     */
    public boolean isInterim() {
        return this == PENDING || this == DEPLOYING || this == SCALING
                || this == UPDATING || this == STOPPING;
    }

    /**
     * 헬스 모니터링 대상에서 제외되는 상태인지 확인합니다.
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
