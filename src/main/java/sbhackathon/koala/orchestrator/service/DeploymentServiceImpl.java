package sbhackathon.koala.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.dto.CreateDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.DeploymentFilter;
import sbhackathon.koala.orchestrator.dto.UpdateDeploymentRequest;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.event.DeploymentStatusPublisher;
import sbhackathon.koala.orchestrator.exception.DeploymentBusyException;
import sbhackathon.koala.orchestrator.exception.DeploymentNotFoundException;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriverRegistry;
import sbhackathon.koala.orchestrator.monitor.HealthMonitor;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;
import sbhackathon.koala.orchestrator.service.lifecycle.DeploymentOperations;
import sbhackathon.koala.orchestrator.service.lifecycle.DeploymentTransitions;
import sbhackathon.koala.orchestrator.service.lifecycle.LifecycleEvent;
import sbhackathon.koala.orchestrator.service.task.DeploymentLease;
import sbhackathon.koala.orchestrator.service.task.DeploymentLeaseRegistry;
import sbhackathon.koala.orchestrator.service.task.DeploymentTaskExecutor;
import sbhackathon.koala.orchestrator.service.task.OperationType;
import sbhackathon.koala.orchestrator.service.task.PendingIntent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

@Service
public class DeploymentServiceImpl implements DeploymentService {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentServiceImpl.class);

    private final DeploymentRepository deploymentRepository;
    private final DeploymentRequestValidator validator;
    private final McpServerImageResolver imageResolver;
    private final ContainerDriverRegistry drivers;
    private final DeploymentTaskExecutor taskExecutor;
    private final DeploymentLeaseRegistry leases;
    private final DeploymentTransitions transitions;
    private final DeploymentOperations operations;
    private final DeploymentStatusPublisher publisher;
    private final HealthMonitor healthMonitor;
    private final OrchestratorProperties.Defaults defaults;

    public DeploymentServiceImpl(DeploymentRepository deploymentRepository,
                                 DeploymentRequestValidator validator,
                                 McpServerImageResolver imageResolver,
                                 ContainerDriverRegistry drivers,
                                 DeploymentTaskExecutor taskExecutor,
                                 DeploymentLeaseRegistry leases,
                                 DeploymentTransitions transitions,
                                 DeploymentOperations operations,
                                 DeploymentStatusPublisher publisher,
                                 HealthMonitor healthMonitor,
                                 OrchestratorProperties properties) {
        this.deploymentRepository = deploymentRepository;
        this.validator = validator;
        this.imageResolver = imageResolver;
        this.drivers = drivers;
        this.taskExecutor = taskExecutor;
        this.leases = leases;
        this.transitions = transitions;
        this.operations = operations;
        this.publisher = publisher;
        this.healthMonitor = healthMonitor;
        this.defaults = properties.getDefaults();
    }

    @Override
    public Deployment createDeployment(CreateDeploymentRequest request, String ownerId) {
        validator.validateCreate(request);

        Optional<Deployment> existing = deploymentRepository.findByName(request.getName());
        if (existing.isPresent()) {
            return sameDeployment(existing.get(), request);
        }

        DeploymentEnvironment environment = DeploymentEnvironment.fromValue(request.getEnvironment());
        BackendType backendType = drivers.backendFor(environment);
        String imageReference = request.getImageReference() != null && !request.getImageReference().isBlank()
                ? request.getImageReference().trim()
                : imageResolver.resolve(request.getMcpServerId());

        Deployment deployment = Deployment.builder()
                .id(UUID.randomUUID().toString())
                .mcpServerId(request.getMcpServerId().trim())
                .name(request.getName())
                .environment(environment)
                .replicaCount(orDefault(request.getReplicaCount(), 1))
                .cpuLimit(orDefault(request.getCpuLimit(), defaults.getCpuLimit()))
                .memoryLimit(orDefault(request.getMemoryLimit(), defaults.getMemoryLimit()))
                .environmentVariables(request.getEnvironmentVariables())
                .healthCheckPath(orDefault(request.getHealthCheckPath(), defaults.getHealthCheckPath()))
                .healthCheckIntervalSeconds(orDefault(request.getHealthCheckIntervalSeconds(),
                        defaults.getHealthCheckIntervalSeconds()))
                .containerPort(orDefault(request.getContainerPort(), defaults.getContainerPort()))
                .imageReference(imageReference)
                .backendType(backendType)
                .ownerId(ownerId)
                .build();

        logger.info("배포 생성 - id: {}, 이름: {}, 환경: {}, 백엔드: {}, replicas: {}",
                deployment.getId(), deployment.getName(), environment, backendType, deployment.getReplicaCount());

        Deployment accepted;
        try {
            accepted = taskExecutor.submit(deployment.getId(), OperationType.DEPLOY,
                    lease -> publisher.publish(deployment, "Deployment accepted"),
                    operations::runDeploy);
        } catch (DataIntegrityViolationException e) {
            // 같은 이름으로 동시에 들어온 생성 요청: 먼저 저장된 쪽을 반환
            return deploymentRepository.findByName(request.getName())
                    .map(found -> sameDeployment(found, request))
                    .orElseThrow(() -> e);
        }
        healthMonitor.watch(accepted);
        return accepted;
    }

    @Override
    public Deployment startDeployment(String deploymentId) {
        requireExists(deploymentId);
        Deployment started = taskExecutor.submit(deploymentId, OperationType.START,
                lease -> transitions.apply(deploymentId, LifecycleEvent.START, Deployment::clearError, "Start requested"),
                operations::runDeploy);
        healthMonitor.watch(started);
        return started;
    }

    @Override
    public Deployment stopDeployment(String deploymentId) {
        requireExists(deploymentId);
        return teardown(deploymentId, PendingIntent.STOP, OperationType.STOP, lease -> {
            Deployment current = transitions.load(deploymentId);
            if (current.getStatus() == DeploymentStatus.STOPPING) {
                return current;
            }
            LifecycleEvent event = switch (current.getStatus()) {
                case DEPLOYING, SCALING, UPDATING -> LifecycleEvent.CANCEL;
                default -> LifecycleEvent.STOP;
            };
            return transitions.apply(deploymentId, event, null, "Stop requested");
        }, operations::runStop);
    }

    @Override
    public Deployment deleteDeployment(String deploymentId) {
        requireExists(deploymentId);
        return teardown(deploymentId, PendingIntent.DELETE, OperationType.DELETE, lease -> {
            Deployment current = transitions.load(deploymentId);
            if (current.getStatus() == DeploymentStatus.STOPPING && current.isDeletionRequested()) {
                return current;
            }
            return transitions.apply(deploymentId, LifecycleEvent.DELETE, Deployment::markDeletionRequested,
                    "Deletion requested");
        }, operations::runDelete);
    }

    @Override
    public Deployment scaleDeployment(String deploymentId, Integer replicas) {
        validator.validateReplicas(replicas);
        requireExists(deploymentId);
        logger.info("스케일 요청 - id: {}, replicas: {}", deploymentId, replicas);
        return taskExecutor.submit(deploymentId, OperationType.SCALE,
                lease -> transitions.apply(deploymentId, LifecycleEvent.SCALE,
                        d -> d.changeReplicaCount(replicas), "Scaling to " + replicas + " replica(s)"),
                operations::runScale);
    }

    @Override
    public Deployment updateDeployment(String deploymentId, UpdateDeploymentRequest request) {
        validator.validateUpdate(request);
        requireExists(deploymentId);
        Deployment updating = taskExecutor.submit(deploymentId, OperationType.UPDATE,
                lease -> transitions.apply(deploymentId, LifecycleEvent.UPDATE, d -> d.applyUpdate(
                        request.getCpuLimit(),
                        request.getMemoryLimit(),
                        request.getEnvironmentVariables(),
                        request.getHealthCheckPath(),
                        request.getHealthCheckIntervalSeconds(),
                        request.getImageReference() != null ? request.getImageReference().trim() : null),
                        "Update requested"),
                operations::runUpdate);
        // 헬스 체크 주기가 바뀌었을 수 있으므로 다시 등록
        healthMonitor.watch(updating);
        return updating;
    }

    @Override
    public Deployment retryDeployment(String deploymentId) {
        requireExists(deploymentId);
        Deployment resubmitted = taskExecutor.submit(deploymentId, OperationType.DEPLOY,
                lease -> transitions.apply(deploymentId, LifecycleEvent.RESUBMIT, Deployment::clearError, "Retry requested"),
                operations::runDeploy);
        healthMonitor.watch(resubmitted);
        return resubmitted;
    }

    @Override
    public Deployment getDeployment(String deploymentId) {
        return deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));
    }

    @Override
    public List<Deployment> listDeployments(DeploymentFilter filter) {
        DeploymentFilter criteria = filter != null ? filter : DeploymentFilter.all();
        return deploymentRepository.search(criteria.getOwnerId(), criteria.getStatus(),
                criteria.getEnvironment(), criteria.getMcpServerId());
    }

    @Override
    public List<String> getDeploymentLogs(String deploymentId, Integer tailLines) {
        int tail = tailLines != null ? tailLines : defaults.getLogTailLines();
        validator.validateLogTail(tail);
        Deployment deployment = getDeployment(deploymentId);

        ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
        List<String> lines = new ArrayList<>();
        driver.streamLogs(DeploymentOperations.handleOf(driver, deployment), tail, lines::add);
        return lines;
    }

    /**
     * stop/delete 공통 처리: 진행 중인 작업이 있으면 취소 의도를 남기고, 없으면 직접 정리 작업을 제출합니다.
     */
    private Deployment teardown(String deploymentId, PendingIntent intent, OperationType operation,
                                Function<DeploymentLease, Deployment> prepare, Consumer<DeploymentLease> work) {
        if (leases.requestCancellation(deploymentId, intent)) {
            return getDeployment(deploymentId);
        }
        try {
            return taskExecutor.submit(deploymentId, operation, prepare, work);
        } catch (DeploymentBusyException e) {
            // lease 확인과 제출 사이에 작업이 시작된 경우
            if (leases.requestCancellation(deploymentId, intent)) {
                return getDeployment(deploymentId);
            }
            throw e;
        }
    }

    private Deployment sameDeployment(Deployment existing, CreateDeploymentRequest request) {
        if (!existing.getMcpServerId().equals(request.getMcpServerId().trim())) {
            throw new DeploymentValidationException("Deployment name '" + request.getName()
                    + "' is already used by another MCP server");
        }
        logger.info("동일한 배포가 이미 존재합니다 - id: {}, 이름: {}", existing.getId(), existing.getName());
        return existing;
    }

    private void requireExists(String deploymentId) {
        if (!deploymentRepository.existsById(deploymentId)) {
            throw new DeploymentNotFoundException(deploymentId);
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
