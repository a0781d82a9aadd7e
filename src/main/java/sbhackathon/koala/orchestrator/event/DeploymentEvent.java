package sbhackathon.koala.orchestrator.event;

import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.entity.HealthStatus;

import java.time.Instant;

/**
 * 저장된 상태/헬스 변경 한 건. 저장되지 않습니다.
 */
public record DeploymentEvent(
        String deploymentId,
        DeploymentStatus status,
        HealthStatus health,
        String message,
        Instant timestamp
) {
    public static DeploymentEvent of(Deployment deployment, String message) {
        return new DeploymentEvent(deployment.getId(), deployment.getStatus(), deployment.getHealth(),
                message, Instant.now());
    }
}
