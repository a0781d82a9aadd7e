package sbhackathon.koala.orchestrator.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.BadRequestException;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.InternalServerErrorException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HealthCheck;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.RestartPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import sbhackathon.koala.orchestrator.config.DockerConfig;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.DriverConflictException;
import sbhackathon.koala.orchestrator.infra.driver.DriverConnectivityException;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.DriverTimeoutException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceExhaustionException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceLimits;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadPhase;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadSpec;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Single-host driver. A workload is a group of containers {@code <name>-<index>} carrying the
 * {@value #LABEL_WORKLOAD} label; the handle is the workload name, so every lookup goes
 * through a label filter and a lost handle can always be recomputed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docker.enabled", havingValue = "true", matchIfMissing = true)
public class DockerContainerDriver implements ContainerDriver {

    static final String LABEL_WORKLOAD = "mcphub.workload";
    static final String LABEL_DEPLOYMENT_ID = "mcphub.deployment-id";
    static final String LABEL_MCP_SERVER_ID = "mcphub.mcp-server-id";
    static final String LABEL_REPLICA = "mcphub.replica";
    static final String LABEL_PORT = "mcphub.port";
    static final String LABEL_HEALTH_PATH = "mcphub.health-path";
    static final String LABEL_MANAGED_BY = "managed-by";
    static final String MANAGED_BY = "mcp-hub";

    private static final String DOCKER_HINT =
            "Ensure Docker is running and that the process can access the Docker socket "
                    + "(for example /var/run/docker.sock) or the configured docker.host.";
    private static final long SECOND_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final DockerClient dockerClient;
    private final DockerConfig dockerConfig;

    @Override
    public BackendType backendType() {
        return BackendType.DOCKER;
    }

    @Override
    public String create(WorkloadSpec spec) {
        spec.validate();
        ResourceLimits limits = ResourceLimits.parse(spec.cpuLimit(), spec.memoryLimit());
        for (int index = 0; index < spec.replicas(); index++) {
            createReplica(spec, limits, index);
        }
        log.info("Docker workload {} created with {} replica(s) from image {}",
                spec.name(), spec.replicas(), spec.image());
        return spec.name();
    }

    @Override
    public void start(String handle) {
        List<Container> replicas = requireReplicas(handle);
        for (Container replica : replicas) {
            if (!isRunning(replica)) {
                startContainer(replica.getId());
            }
        }
        log.info("Docker workload {} started ({} replica(s))", handle, replicas.size());
    }

    @Override
    public void stop(String handle) {
        List<Container> replicas = requireReplicas(handle);
        for (Container replica : replicas) {
            if (isRunning(replica)) {
                stopContainer(replica.getId());
            }
        }
        log.info("Docker workload {} stopped", handle);
    }

    @Override
    public void scale(String handle, int replicas) {
        if (replicas < 1) {
            throw new InvalidSpecException("replicas must be positive: " + replicas);
        }
        List<Container> existing = requireReplicas(handle);
        Map<Integer, Container> byIndex = new HashMap<>();
        for (Container container : existing) {
            byIndex.put(replicaIndex(container), container);
        }

        Container template = existing.get(0);
        boolean running = existing.stream().anyMatch(this::isRunning);
        InspectContainerResponse templateInspect = null;
        for (int index = 0; index < replicas; index++) {
            if (byIndex.containsKey(index)) {
                continue;
            }
            if (templateInspect == null) {
                templateInspect = callDocker("inspect container " + template.getId(),
                        () -> dockerClient.inspectContainerCmd(template.getId()).exec());
            }
            String containerId = cloneReplica(handle, templateInspect, index);
            if (running) {
                startContainer(containerId);
            }
        }

        for (Map.Entry<Integer, Container> entry : byIndex.entrySet()) {
            if (entry.getKey() >= replicas) {
                removeContainer(entry.getValue().getId());
            }
        }
        log.info("Docker workload {} scaled from {} to {} replica(s)", handle, existing.size(), replicas);
    }

    @Override
    public void update(String handle, WorkloadSpec spec) {
        spec.validate();
        ResourceLimits limits = ResourceLimits.parse(spec.cpuLimit(), spec.memoryLimit());
        List<Container> existing = requireReplicas(handle);
        boolean running = existing.stream().anyMatch(this::isRunning);

        // 한 replica 씩 교체합니다.
        for (Container old : existing) {
            int index = replicaIndex(old);
            removeContainer(old.getId());
            if (index < spec.replicas()) {
                String containerId = createReplica(spec, limits, index);
                if (running) {
                    startContainer(containerId);
                }
            }
        }
        for (int index = existing.size(); index < spec.replicas(); index++) {
            String containerId = createReplica(spec, limits, index);
            if (running) {
                startContainer(containerId);
            }
        }
        log.info("Docker workload {} updated to image {}", handle, spec.image());
    }

    @Override
    public void delete(String handle) {
        List<Container> replicas = listReplicas(handle);
        for (Container replica : replicas) {
            removeContainer(replica.getId());
        }
        log.info("Docker workload {} deleted ({} container(s) removed)", handle, replicas.size());
    }

    @Override
    public WorkloadStatus getStatus(String handle) {
        List<Container> replicas = listReplicas(handle);
        if (replicas.isEmpty()) {
            return WorkloadStatus.missing(handle);
        }

        int ready = 0;
        int running = 0;
        boolean dead = false;
        boolean restarting = false;
        for (Container replica : replicas) {
            String state = lower(replica.getState());
            if (isRunning(replica)) {
                running++;
                if (isHealthy(replica)) {
                    ready++;
                }
            }
            dead |= "dead".equals(state);
            restarting |= "restarting".equals(state);
        }

        WorkloadPhase phase;
        if (dead) {
            phase = WorkloadPhase.FAILED;
        } else if (ready == replicas.size()) {
            phase = WorkloadPhase.RUNNING;
        } else if (running == 0 && !restarting) {
            phase = WorkloadPhase.STOPPED;
        } else {
            phase = WorkloadPhase.PROGRESSING;
        }

        String message = String.format("%d/%d replica(s) ready", ready, replicas.size());
        return new WorkloadStatus(phase, replicas.size(), ready, message, endpointOf(replicas.get(0)));
    }

    @Override
    public void streamLogs(String handle, int tailLines, Consumer<String> sink) {
        List<Container> replicas = requireReplicas(handle);
        boolean prefix = replicas.size() > 1;
        for (Container replica : replicas) {
            String name = containerName(replica);
            ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
                @Override
                public void onNext(Frame frame) {
                    String line = new String(frame.getPayload(), StandardCharsets.UTF_8).stripTrailing();
                    sink.accept(prefix ? "[" + name + "] " + line : line);
                }
            };
            try {
                boolean completed = callDocker("read logs of " + name, () -> dockerClient.logContainerCmd(replica.getId())
                        .withStdOut(true)
                        .withStdErr(true)
                        .withTail(tailLines)
                        .exec(callback))
                        .awaitCompletion(dockerConfig.getLogTimeoutSeconds(), TimeUnit.SECONDS);
                if (!completed) {
                    throw new DriverTimeoutException("Timed out reading logs of container " + name);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("Interrupted while reading logs of container " + name, e);
            }
        }
    }

    private String createReplica(WorkloadSpec spec, ResourceLimits limits, int index) {
        String containerName = spec.name() + "-" + index;
        try {
            return callDocker("create container " + containerName, () -> buildCreateCommand(spec, limits, index).exec().getId());
        } catch (DriverConflictException e) {
            String adopted = adopt(containerName, spec.name());
            log.info("Container {} already exists, adopting {}", containerName, adopted);
            return adopted;
        } catch (WorkloadNotFoundException e) {
            // 로컬에 이미지가 없으면 pull 후 한 번 더 시도합니다.
            pullImage(spec.image());
            try {
                return callDocker("create container " + containerName, () -> buildCreateCommand(spec, limits, index).exec().getId());
            } catch (DriverConflictException conflict) {
                return adopt(containerName, spec.name());
            }
        }
    }

    private CreateContainerCmd buildCreateCommand(WorkloadSpec spec, ResourceLimits limits, int index) {
        Map<String, String> labels = new HashMap<>();
        labels.put(LABEL_WORKLOAD, spec.name());
        labels.put(LABEL_DEPLOYMENT_ID, String.valueOf(spec.deploymentId()));
        labels.put(LABEL_MCP_SERVER_ID, String.valueOf(spec.mcpServerId()));
        labels.put(LABEL_REPLICA, String.valueOf(index));
        labels.put(LABEL_PORT, String.valueOf(spec.containerPort()));
        labels.put(LABEL_HEALTH_PATH, spec.healthCheckPath());
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);

        HostConfig hostConfig = HostConfig.newHostConfig()
                .withNanoCPUs(limits.nanoCpus())
                .withMemory(limits.memoryBytes())
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart());
        if (StringUtils.hasText(dockerConfig.getNetwork())) {
            hostConfig.withNetworkMode(dockerConfig.getNetwork());
        }

        return dockerClient.createContainerCmd(spec.image())
                .withName(spec.name() + "-" + index)
                .withEnv(toEnvArray(spec.environment()))
                .withLabels(labels)
                .withExposedPorts(ExposedPort.tcp(spec.containerPort()))
                .withHealthcheck(healthCheck(spec.containerPort(), spec.healthCheckPath()))
                .withHostConfig(hostConfig);
    }

    private String cloneReplica(String handle, InspectContainerResponse template, int index) {
        ContainerConfig config = template.getConfig();
        Map<String, String> labels = new HashMap<>(config.getLabels() != null ? config.getLabels() : Map.of());
        labels.put(LABEL_REPLICA, String.valueOf(index));
        String containerName = handle + "-" + index;

        CreateContainerCmd command = dockerClient.createContainerCmd(config.getImage())
                .withName(containerName)
                .withLabels(labels)
                .withHostConfig(template.getHostConfig());
        if (config.getEnv() != null) {
            command.withEnv(config.getEnv());
        }
        if (config.getExposedPorts() != null) {
            command.withExposedPorts(config.getExposedPorts());
        }
        if (config.getHealthcheck() != null) {
            command.withHealthcheck(config.getHealthcheck());
        }
        try {
            return callDocker("create container " + containerName, () -> command.exec().getId());
        } catch (DriverConflictException e) {
            return adopt(containerName, handle);
        }
    }

    private String adopt(String containerName, String workloadName) {
        InspectContainerResponse existing = callDocker("inspect container " + containerName,
                () -> dockerClient.inspectContainerCmd(containerName).exec());
        Map<String, String> labels = existing.getConfig() != null ? existing.getConfig().getLabels() : null;
        if (labels == null || !workloadName.equals(labels.get(LABEL_WORKLOAD))) {
            throw new InvalidSpecException("Container name " + containerName
                    + " is taken by a container that does not belong to workload " + workloadName);
        }
        return existing.getId();
    }

    private void pullImage(String image) {
        log.info("Image {} not present locally, pulling", image);
        try {
            boolean completed = callDocker("pull image " + image,
                    () -> dockerClient.pullImageCmd(image).exec(new PullImageResultCallback()))
                    .awaitCompletion(dockerConfig.getPullTimeoutSeconds(), TimeUnit.SECONDS);
            if (!completed) {
                throw new DriverTimeoutException("Timed out pulling image " + image);
            }
        } catch (WorkloadNotFoundException e) {
            throw new InvalidSpecException("Image not found: " + image, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Interrupted while pulling image " + image, e);
        }
    }

    private void startContainer(String containerId) {
        try {
            callDocker("start container " + containerId, () -> dockerClient.startContainerCmd(containerId).exec());
        } catch (NotModifiedException e) {
            log.debug("Container {} already running", containerId);
        }
    }

    private void stopContainer(String containerId) {
        try {
            callDocker("stop container " + containerId, () -> dockerClient.stopContainerCmd(containerId)
                    .withTimeout(dockerConfig.getStopTimeoutSeconds())
                    .exec());
        } catch (NotModifiedException e) {
            log.debug("Container {} already stopped", containerId);
        }
    }

    private void removeContainer(String containerId) {
        try {
            callDocker("remove container " + containerId, () -> dockerClient.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec());
        } catch (WorkloadNotFoundException e) {
            log.debug("Container {} already removed", containerId);
        }
    }

    private List<Container> listReplicas(String handle) {
        List<Container> containers = callDocker("list containers of " + handle, () -> dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(LABEL_WORKLOAD, handle))
                .exec());
        List<Container> sorted = new ArrayList<>(containers != null ? containers : List.of());
        sorted.sort(Comparator.comparingInt(DockerContainerDriver::replicaIndex));
        return sorted;
    }

    private List<Container> requireReplicas(String handle) {
        List<Container> replicas = listReplicas(handle);
        if (replicas.isEmpty()) {
            throw new WorkloadNotFoundException(handle);
        }
        return replicas;
    }

    private boolean isRunning(Container container) {
        return "running".equals(lower(container.getState()));
    }

    /**
     * Docker 는 헬스 상태를 status 문자열에만 노출합니다 ("Up 3 minutes (healthy)").
     */
    private boolean isHealthy(Container container) {
        String status = lower(container.getStatus());
        return !status.contains("(unhealthy)") && !status.contains("(health: starting)");
    }

    private String endpointOf(Container container) {
        Map<String, String> labels = container.getLabels();
        String port = labels != null ? labels.get(LABEL_PORT) : null;
        if (port == null) {
            return null;
        }
        return "http://" + containerName(container) + ":" + port;
    }

    private static int replicaIndex(Container container) {
        Map<String, String> labels = container.getLabels();
        String value = labels != null ? labels.get(LABEL_REPLICA) : null;
        if (value == null) {
            return Integer.MAX_VALUE;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String containerName(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return container.getId();
        }
        String name = names[0];
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private static HealthCheck healthCheck(int port, String path) {
        String url = "http://localhost:" + port + (path.startsWith("/") ? path : "/" + path);
        return new HealthCheck()
                .withTest(List.of("CMD-SHELL", "wget -qO- " + url + " >/dev/null 2>&1 || curl -fsS " + url + " >/dev/null || exit 1"))
                .withInterval(10 * SECOND_NANOS)
                .withTimeout(5 * SECOND_NANOS)
                .withStartPeriod(10 * SECOND_NANOS)
                .withRetries(3);
    }

    private static String[] toEnvArray(Map<String, String> env) {
        return env.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .toArray(String[]::new);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (NotModifiedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        callDocker(action, () -> {
            runnable.run();
            return null;
        });
    }

    DriverException translate(String action, RuntimeException e) {
        if (e instanceof DriverException driverException) {
            return driverException;
        }
        if (e instanceof NotFoundException) {
            return new WorkloadNotFoundException(action, e);
        }
        if (e instanceof ConflictException) {
            return new DriverConflictException("Unable to " + action + ": " + e.getMessage(), e);
        }
        if (e instanceof BadRequestException) {
            return new InvalidSpecException("Unable to " + action + ": " + e.getMessage(), e);
        }
        if (isTimeout(e)) {
            return new DriverTimeoutException("Timed out trying to " + action, e);
        }
        if (isDockerUnavailable(e)) {
            return new DriverConnectivityException(
                    "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT, e);
        }
        if (e instanceof InternalServerErrorException && isExhaustion(e)) {
            return new ResourceExhaustionException("Unable to " + action + ": " + e.getMessage(), e);
        }
        return new DriverException("Unable to " + action + ": " + e.getMessage(), e);
    }

    private boolean isTimeout(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private boolean isExhaustion(Throwable t) {
        return messageContains(t, "no space left on device")
                || messageContains(t, "cannot allocate memory")
                || messageContains(t, "out of memory");
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof NoRouteToHostException
                    || t instanceof UnknownHostException
                    || t instanceof FileNotFoundException
                    || t instanceof NoSuchFileException
                    || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "Could not find a valid Docker environment")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
                .contains(needle.toLowerCase(Locale.ROOT));
    }
}
