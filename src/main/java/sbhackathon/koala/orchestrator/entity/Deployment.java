package sbhackathon.koala.orchestrator.entity;

import jakarta.persistence.*;
import lombok.*;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Getter
@ToString(exclude = {"environmentVariables"})
@Table(name = "deployments",
        uniqueConstraints = @UniqueConstraint(name = "uk_deployments_name", columnNames = "name"),
        indexes = {
                @Index(name = "idx_deployments_status", columnList = "status"),
                @Index(name = "idx_deployments_owner", columnList = "owner_id"),
                @Index(name = "idx_deployments_mcp_server", columnList = "mcp_server_id")
        })
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Deployment {

    public static final int MIN_REPLICAS = 1;
    public static final int MAX_REPLICAS = 10;
    public static final int MIN_HEALTH_CHECK_INTERVAL_SECONDS = 10;
    public static final int MAX_HEALTH_CHECK_INTERVAL_SECONDS = 300;

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "mcp_server_id", nullable = false)
    private String mcpServerId;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "environment", nullable = false, length = 20)
    private DeploymentEnvironment environment;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DeploymentStatus status = DeploymentStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "health", nullable = false, length = 20)
    private HealthStatus health = HealthStatus.UNKNOWN;

    @Column(name = "replica_count", nullable = false)
    private int replicaCount;

    @Column(name = "cpu_limit", length = 50)
    private String cpuLimit;

    @Column(name = "memory_limit", length = 50)
    private String memoryLimit;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_environment_variables",
            joinColumns = @JoinColumn(name = "deployment_id"))
    @MapKeyColumn(name = "var_name")
    @Column(name = "var_value", length = 4096)
    private Map<String, String> environmentVariables = new HashMap<>();

    @Column(name = "health_check_path", nullable = false)
    private String healthCheckPath;

    @Column(name = "health_check_interval_seconds", nullable = false)
    private int healthCheckIntervalSeconds;

    @Column(name = "container_port", nullable = false)
    private int containerPort;

    @Column(name = "image_reference", nullable = false, length = 512)
    private String imageReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "backend_type", nullable = false, length = 20)
    private BackendType backendType;

    @Column(name = "backend_handle")
    private String backendHandle;

    @Column(name = "endpoint_url", length = 2048)
    private String endpointUrl;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "deletion_requested", nullable = false)
    private boolean deletionRequested;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Builder
    public Deployment(String id, String mcpServerId, String name, DeploymentEnvironment environment,
                      int replicaCount, String cpuLimit, String memoryLimit,
                      Map<String, String> environmentVariables, String healthCheckPath,
                      int healthCheckIntervalSeconds, int containerPort, String imageReference,
                      BackendType backendType, String ownerId) {
        this.id = id;
        this.mcpServerId = mcpServerId;
        this.name = name;
        this.environment = environment;
        this.cpuLimit = cpuLimit;
        this.memoryLimit = memoryLimit;
        this.environmentVariables = environmentVariables != null ? new HashMap<>(environmentVariables) : new HashMap<>();
        this.healthCheckPath = healthCheckPath;
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
        this.containerPort = containerPort;
        this.imageReference = imageReference;
        this.backendType = backendType;
        this.ownerId = ownerId;
        this.status = DeploymentStatus.PENDING;
        this.health = HealthStatus.UNKNOWN;
        this.statusChangedAt = Instant.now();
        changeReplicaCount(replicaCount);
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public void transitionTo(DeploymentStatus next) {
        if (this.status != next) {
            this.statusChangedAt = Instant.now();
        }
        this.status = next;
    }

    public void updateHealth(HealthStatus health) {
        this.health = health;
    }

    public void changeReplicaCount(int replicaCount) {
        if (replicaCount < MIN_REPLICAS || replicaCount > MAX_REPLICAS) {
            throw new DeploymentValidationException(String.format(
                    "replicaCount must be between %d and %d but was %d",
                    MIN_REPLICAS, MAX_REPLICAS, replicaCount));
        }
        this.replicaCount = replicaCount;
    }

    public void applyUpdate(String cpuLimit, String memoryLimit, Map<String, String> environmentVariables,
                            String healthCheckPath, Integer healthCheckIntervalSeconds, String imageReference) {
        if (cpuLimit != null) {
            this.cpuLimit = cpuLimit;
        }
        if (memoryLimit != null) {
            this.memoryLimit = memoryLimit;
        }
        if (environmentVariables != null) {
            this.environmentVariables.clear();
            this.environmentVariables.putAll(environmentVariables);
        }
        if (healthCheckPath != null) {
            this.healthCheckPath = healthCheckPath;
        }
        if (healthCheckIntervalSeconds != null) {
            this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
        }
        if (imageReference != null) {
            this.imageReference = imageReference;
        }
    }

    public void assignBackendHandle(String backendHandle) {
        this.backendHandle = backendHandle;
    }

    public void updateEndpointUrl(String endpointUrl) {
        this.endpointUrl = endpointUrl;
    }

    public void recordError(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public void clearError() {
        this.errorMessage = null;
    }

    public void markDeletionRequested() {
        this.deletionRequested = true;
    }

    /**
     * 백엔드(Docker 컨테이너 그룹 / K8s Deployment)에서 사용하는 워크로드 이름.
     */
    public String workloadName() {
        return "mcp-" + name;
    }
}
