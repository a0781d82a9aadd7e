package sbhackathon.koala.orchestrator.service;

import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.dto.CreateDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.UpdateDeploymentRequest;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceLimits;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 배포 요청의 유효성을 검증합니다. 실패 시 {@link DeploymentValidationException} 을 던지며,
 * 이 경우 레코드나 인프라는 전혀 변경되지 않습니다.
 */
@Component
public class DeploymentRequestValidator {

    static final int MAX_NAME_LENGTH = 50;
    static final int MAX_LOG_TAIL = 10_000;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9]([a-z0-9-]*[a-z0-9])?$");
    private static final Pattern ENV_KEY_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public void validateCreate(CreateDeploymentRequest request) {
        if (request == null) {
            throw new DeploymentValidationException("요청 본문이 비어있습니다.");
        }
        validateName(request.getName());
        if (isBlank(request.getMcpServerId())) {
            throw new DeploymentValidationException("mcpServerId is required");
        }
        try {
            DeploymentEnvironment.fromValue(request.getEnvironment());
        } catch (IllegalArgumentException e) {
            throw new DeploymentValidationException("Invalid environment: " + request.getEnvironment()
                    + " (expected development, staging or production)", e);
        }
        if (request.getReplicaCount() != null) {
            validateReplicas(request.getReplicaCount());
        }
        if (request.getHealthCheckIntervalSeconds() != null) {
            validateInterval(request.getHealthCheckIntervalSeconds());
        }
        if (request.getContainerPort() != null
                && (request.getContainerPort() < 1 || request.getContainerPort() > 65535)) {
            throw new DeploymentValidationException("containerPort must be between 1 and 65535");
        }
        if (request.getHealthCheckPath() != null) {
            validateHealthCheckPath(request.getHealthCheckPath());
        }
        validateLimits(request.getCpuLimit(), request.getMemoryLimit());
        validateEnvironmentVariables(request.getEnvironmentVariables());
    }

    public void validateUpdate(UpdateDeploymentRequest request) {
        if (request == null) {
            throw new DeploymentValidationException("요청 본문이 비어있습니다.");
        }
        if (request.getHealthCheckIntervalSeconds() != null) {
            validateInterval(request.getHealthCheckIntervalSeconds());
        }
        if (request.getHealthCheckPath() != null) {
            validateHealthCheckPath(request.getHealthCheckPath());
        }
        if (request.getImageReference() != null && request.getImageReference().isBlank()) {
            throw new DeploymentValidationException("imageReference must not be blank");
        }
        validateLimits(request.getCpuLimit(), request.getMemoryLimit());
        validateEnvironmentVariables(request.getEnvironmentVariables());
    }

    public void validateReplicas(Integer replicas) {
        if (replicas == null) {
            throw new DeploymentValidationException("replicas is required");
        }
        if (replicas < Deployment.MIN_REPLICAS || replicas > Deployment.MAX_REPLICAS) {
            throw new DeploymentValidationException(String.format("replicas must be between %d and %d but was %d",
                    Deployment.MIN_REPLICAS, Deployment.MAX_REPLICAS, replicas));
        }
    }

    public void validateLogTail(int tail) {
        if (tail < 1 || tail > MAX_LOG_TAIL) {
            throw new DeploymentValidationException("tail must be between 1 and " + MAX_LOG_TAIL);
        }
    }

    private void validateName(String name) {
        if (isBlank(name)) {
            throw new DeploymentValidationException("name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new DeploymentValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new DeploymentValidationException("name must consist of lower case letters, digits and '-', "
                    + "and start and end with a letter or digit: " + name);
        }
    }

    private void validateInterval(int seconds) {
        if (seconds < Deployment.MIN_HEALTH_CHECK_INTERVAL_SECONDS || seconds > Deployment.MAX_HEALTH_CHECK_INTERVAL_SECONDS) {
            throw new DeploymentValidationException(String.format("healthCheckIntervalSeconds must be between %d and %d",
                    Deployment.MIN_HEALTH_CHECK_INTERVAL_SECONDS, Deployment.MAX_HEALTH_CHECK_INTERVAL_SECONDS));
        }
    }

    private void validateHealthCheckPath(String path) {
        if (!path.startsWith("/")) {
            throw new DeploymentValidationException("healthCheckPath must start with '/': " + path);
        }
    }

    private void validateLimits(String cpuLimit, String memoryLimit) {
        if (cpuLimit == null && memoryLimit == null) {
            return;
        }
        try {
            // 한쪽만 주어진 경우 다른 쪽은 유효한 임의 값으로 채워 개별 검증
            ResourceLimits.parse(cpuLimit != null ? cpuLimit : "1", memoryLimit != null ? memoryLimit : "1Mi");
        } catch (InvalidSpecException e) {
            throw new DeploymentValidationException(e.getMessage(), e);
        }
    }

    private void validateEnvironmentVariables(Map<String, String> variables) {
        if (variables == null) {
            return;
        }
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            if (entry.getKey() == null || !ENV_KEY_PATTERN.matcher(entry.getKey()).matches()) {
                throw new DeploymentValidationException("Invalid environment variable name: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new DeploymentValidationException("Environment variable " + entry.getKey() + " has no value");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
