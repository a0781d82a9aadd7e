package sbhackathon.koala.orchestrator.dto;

import lombok.Builder;
import lombok.Getter;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;

/**
 * 배포 목록 조회 조건. null 인 조건은 적용하지 않습니다.
 */
@Getter
@Builder
public class DeploymentFilter {
    private final String ownerId;
    private final DeploymentStatus status;
    private final DeploymentEnvironment environment;
    private final String mcpServerId;

    public static DeploymentFilter all() {
        return DeploymentFilter.builder().build();
    }
}
