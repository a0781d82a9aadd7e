package sbhackathon.koala.orchestrator.dto;

import lombok.Builder;
import lombok.Getter;
import sbhackathon.koala.orchestrator.entity.Deployment;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Getter
@Builder
public class DeploymentResponse {
    private final String id;
    private final String mcpServerId;
    private final String name;
    private final String environment;
    private final String status;
    private final String statusDescription;
    private final String health;
    private final int replicaCount;
    private final String cpuLimit;
    private final String memoryLimit;
    private final Map<String, String> environmentVariables;
    private final String healthCheckPath;
    private final int healthCheckIntervalSeconds;
    private final int containerPort;
    private final String imageReference;
    private final String backendType;
    private final String endpointUrl;
    private final String errorMessage;
    private final boolean deletionRequested;
    private final String ownerId;
    private final Instant statusChangedAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    public static DeploymentResponse from(Deployment deployment) {
        return DeploymentResponse.builder()
                .id(deployment.getId())
                .mcpServerId(deployment.getMcpServerId())
                .name(deployment.getName())
                .environment(deployment.getEnvironment().name().toLowerCase(Locale.ROOT))
                .status(deployment.getStatus().name())
                .statusDescription(deployment.getStatus().getDescription())
                .health(deployment.getHealth().name())
                .replicaCount(deployment.getReplicaCount())
                .cpuLimit(deployment.getCpuLimit())
                .memoryLimit(deployment.getMemoryLimit())
                .environmentVariables(new TreeMap<>(deployment.getEnvironmentVariables()))
                .healthCheckPath(deployment.getHealthCheckPath())
                .healthCheckIntervalSeconds(deployment.getHealthCheckIntervalSeconds())
                .containerPort(deployment.getContainerPort())
                .imageReference(deployment.getImageReference())
                .backendType(deployment.getBackendType().name())
                .endpointUrl(deployment.getEndpointUrl())
                .errorMessage(deployment.getErrorMessage())
                .deletionRequested(deployment.isDeletionRequested())
                .ownerId(deployment.getOwnerId())
                .statusChangedAt(deployment.getStatusChangedAt())
                .createdAt(deployment.getCreatedAt())
                .updatedAt(deployment.getUpdatedAt())
                .build();
    }
}
