package sbhackathon.koala.orchestrator.infra.driver;

import java.util.Map;

/**
 * Everything a driver needs to materialise one deployment on its backend.
 *
 * @param name             logical workload name, unique per backend; drivers adopt an existing object with this name
 * @param deploymentId     owning deployment id, attached to backend objects as a label
 * @param mcpServerId      generated server the image was built from
 * @param image            fully qualified image reference
 * @param replicas         desired replica count
 * @param cpuLimit         CPU limit as a Kubernetes quantity ("500m", "1")
 * @param memoryLimit      memory limit as a Kubernetes quantity ("512Mi", "1Gi")
 * @param environment      container environment variables
 * @param containerPort    port the MCP server listens on
 * @param healthCheckPath  HTTP path probed for readiness/liveness
 */
public record WorkloadSpec(
        String name,
        String deploymentId,
        String mcpServerId,
        String image,
        int replicas,
        String cpuLimit,
        String memoryLimit,
        Map<String, String> environment,
        int containerPort,
        String healthCheckPath
) {
    public WorkloadSpec {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidSpecException("workload name must not be blank");
        }
        if (image == null || image.isBlank()) {
            throw new InvalidSpecException("image must not be blank for workload " + name);
        }
        if (replicas < 1) {
            throw new InvalidSpecException("replicas must be positive for workload " + name);
        }
        if (containerPort < 1 || containerPort > 65535) {
            throw new InvalidSpecException("containerPort out of range for workload " + name);
        }
        ResourceLimits.parse(cpuLimit, memoryLimit);
    }
}
