package sbhackathon.koala.orchestrator.service.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.entity.HealthStatus;
import sbhackathon.koala.orchestrator.event.DeploymentStatusPublisher;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriverRegistry;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.DriverTimeoutException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadFailedException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadPhase;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadSpec;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;
import sbhackathon.koala.orchestrator.service.task.DeploymentLease;
import sbhackathon.koala.orchestrator.service.task.OperationCancelledException;
import sbhackathon.koala.orchestrator.service.task.PendingIntent;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 작업 풀에서 lease 를 쥔 채로 실행되는 배포 작업 본문.
 * <p>
 * 각 작업은 기대하는 중간 상태를 확인하고, driver 호출을 {@link RetryPolicy} 로 감싸 실행한 뒤
 * SUCCEED / FAIL 전이로 끝납니다. driver 호출 사이, 재시도 사이, readiness 대기 중에
 * lease 의 취소 요청을 확인하며, 취소되면 STOPPING 을 거쳐 만들어진 리소스를 정리합니다.
 */
@Slf4j
@Component
public class DeploymentOperations {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 4000;
    private static final Set<DeploymentStatus> CANCELLABLE_STATES =
            EnumSet.of(DeploymentStatus.DEPLOYING, DeploymentStatus.SCALING, DeploymentStatus.UPDATING);

    private final ContainerDriverRegistry drivers;
    private final DeploymentTransitions transitions;
    private final DeploymentStatusPublisher publisher;
    private final DeploymentRepository repository;
    private final RetryPolicy retryPolicy;
    private final Duration readyTimeout;
    private final Duration readyPollInterval;

    public DeploymentOperations(ContainerDriverRegistry drivers,
                                DeploymentTransitions transitions,
                                DeploymentStatusPublisher publisher,
                                DeploymentRepository repository,
                                RetryPolicy retryPolicy,
                                OrchestratorProperties properties) {
        this.drivers = drivers;
        this.transitions = transitions;
        this.publisher = publisher;
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.readyTimeout = properties.getDeploy().getReadyTimeout();
        this.readyPollInterval = properties.getDeploy().getReadyPollInterval();
    }

    /**
     * PENDING 또는 DEPLOYING 배포를 생성 → 시작 → readiness 확인까지 진행합니다.
     */
    public void runDeploy(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        try {
            Deployment deployment = transitions.load(id);
            if (deployment.getStatus() == DeploymentStatus.PENDING) {
                deployment = transitions.apply(id, LifecycleEvent.SUBMIT, Deployment::clearError, "Deploying");
            } else if (deployment.getStatus() != DeploymentStatus.DEPLOYING) {
                log.info("Deployment {} is {}, nothing to deploy", id, deployment.getStatus());
                return;
            }

            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            WorkloadSpec spec = toSpec(deployment);
            String handle = retryPolicy.execute(id, "create workload " + spec.name(),
                    () -> driver.create(spec), lease::throwIfCancellationRequested);
            if (!handle.equals(deployment.getBackendHandle())) {
                deployment = transitions.record(id, d -> d.assignBackendHandle(handle));
            }

            retryPolicy.run(id, "start workload " + handle, () -> driver.start(handle), lease::throwIfCancellationRequested);
            WorkloadStatus status = awaitReady(lease, driver, handle, deployment.getReplicaCount());
            lease.throwIfAbandoned();
            transitions.apply(id, LifecycleEvent.SUCCEED, d -> markRunning(d, status),
                    String.format("Deployment is running with %d replica(s)", status.replicasReady()));
        } catch (OperationCancelledException e) {
            handleCancellation(lease);
        } catch (DriverException e) {
            fail(lease, "Deployment failed", e);
        }
    }

    public void runScale(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        try {
            Deployment deployment = transitions.load(id);
            if (deployment.getStatus() != DeploymentStatus.SCALING) {
                log.info("Deployment {} is {}, nothing to scale", id, deployment.getStatus());
                return;
            }
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            String handle = handleOf(driver, deployment);
            int replicas = deployment.getReplicaCount();

            retryPolicy.run(id, "scale workload " + handle + " to " + replicas,
                    () -> driver.scale(handle, replicas), lease::throwIfCancellationRequested);
            WorkloadStatus status = awaitReady(lease, driver, handle, replicas);
            lease.throwIfAbandoned();
            transitions.apply(id, LifecycleEvent.SUCCEED, d -> markRunning(d, status),
                    String.format("Scaled to %d replica(s)", replicas));
        } catch (OperationCancelledException e) {
            handleCancellation(lease);
        } catch (DriverException e) {
            fail(lease, "Scaling failed", e);
        }
    }

    public void runUpdate(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        try {
            Deployment deployment = transitions.load(id);
            if (deployment.getStatus() != DeploymentStatus.UPDATING) {
                log.info("Deployment {} is {}, nothing to update", id, deployment.getStatus());
                return;
            }
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            String handle = handleOf(driver, deployment);
            WorkloadSpec spec = toSpec(deployment);

            retryPolicy.run(id, "update workload " + handle,
                    () -> driver.update(handle, spec), lease::throwIfCancellationRequested);
            WorkloadStatus status = awaitReady(lease, driver, handle, spec.replicas());
            lease.throwIfAbandoned();
            transitions.apply(id, LifecycleEvent.SUCCEED, d -> markRunning(d, status), "Update rolled out");
        } catch (OperationCancelledException e) {
            handleCancellation(lease);
        } catch (DriverException e) {
            fail(lease, "Update failed", e);
        }
    }

    /**
     * STOPPING 배포를 중지합니다. 삭제가 요청된 배포는 {@link #runDelete} 로 넘깁니다.
     */
    public void runStop(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        try {
            Deployment deployment = transitions.load(id);
            if (deployment.getStatus() != DeploymentStatus.STOPPING) {
                log.info("Deployment {} is {}, nothing to stop", id, deployment.getStatus());
                return;
            }
            if (deployment.isDeletionRequested()) {
                runDelete(lease);
                return;
            }
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            String handle = handleOf(driver, deployment);
            try {
                retryPolicy.run(id, "stop workload " + handle, () -> driver.stop(handle), lease::throwIfCancellationRequested);
            } catch (WorkloadNotFoundException e) {
                log.info("Deployment {}: workload {} not found, treating as stopped", id, handle);
            }
            lease.throwIfAbandoned();
            transitions.apply(id, LifecycleEvent.SUCCEED, d -> {
                d.updateHealth(HealthStatus.UNKNOWN);
                d.updateEndpointUrl(null);
            }, "Deployment stopped");
        } catch (OperationCancelledException e) {
            handleCancellation(lease);
        } catch (DriverException e) {
            fail(lease, "Stop failed", e);
        }
    }

    /**
     * 인프라를 제거하고, driver 가 워크로드 부재를 확인한 뒤에만 레코드를 삭제합니다.
     */
    public void runDelete(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        Optional<Deployment> found = repository.findById(id);
        if (found.isEmpty()) {
            log.info("Deployment {} already removed", id);
            return;
        }
        Deployment deployment = found.get();
        if (deployment.getStatus() != DeploymentStatus.STOPPING || !deployment.isDeletionRequested()) {
            log.info("Deployment {} is {} without a delete request, nothing to delete", id, deployment.getStatus());
            return;
        }
        try {
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            String handle = handleOf(driver, deployment);
            retryPolicy.run(id, "delete workload " + handle, () -> driver.delete(handle), lease::throwIfCancellationRequested);
            awaitAbsent(lease, driver, handle);
            lease.throwIfAbandoned();
            publisher.publishRemoval(transitions.load(id));
        } catch (OperationCancelledException e) {
            // stop 작업에서 넘어온 경우 뒤늦은 delete 요청: 이미 삭제 중이므로 흡수하고 다시 확인
            lease.acknowledgeCancellation();
            runDelete(lease);
        } catch (DriverException e) {
            fail(lease, "Deletion failed", e);
        }
    }

    /**
     * 헬스 모니터가 요청한 복구: 워크로드가 없으면 다시 만들고, 있으면 원하는 replica 수로 맞춘 뒤 시작합니다.
     * 결과 확인은 다음 헬스 체크에서 합니다.
     */
    public void runRecovery(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        try {
            Deployment deployment = transitions.load(id);
            if (deployment.getStatus() != DeploymentStatus.RUNNING) {
                log.info("Deployment {} is {}, skipping recovery", id, deployment.getStatus());
                return;
            }
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            String handle = handleOf(driver, deployment);
            WorkloadStatus status = retryPolicy.execute(id, "inspect workload " + handle,
                    () -> driver.getStatus(handle), lease::throwIfCancellationRequested);

            String target = handle;
            if (!status.exists()) {
                WorkloadSpec spec = toSpec(deployment);
                target = retryPolicy.execute(id, "re-create workload " + spec.name(),
                        () -> driver.create(spec), lease::throwIfCancellationRequested);
                if (!target.equals(deployment.getBackendHandle())) {
                    String recreated = target;
                    transitions.record(id, d -> d.assignBackendHandle(recreated));
                }
            } else {
                int replicas = deployment.getReplicaCount();
                retryPolicy.run(id, "scale workload " + handle, () -> driver.scale(handle, replicas),
                        lease::throwIfCancellationRequested);
            }
            String started = target;
            retryPolicy.run(id, "start workload " + started, () -> driver.start(started), lease::throwIfCancellationRequested);
            log.info("Deployment {}: recovery actions issued for workload {}", id, started);
        } catch (OperationCancelledException e) {
            handleCancellation(lease);
        } catch (DriverException e) {
            log.warn("Deployment {}: recovery attempt failed: {}", id, e.getMessage());
        }
    }

    /**
     * 접수됐지만 처리되지 못한 stop/delete 요청을 현재 상태에서 이어서 실행합니다.
     * 이미 중지됐거나 실패한 배포에 대한 stop 은 아무 것도 하지 않습니다.
     */
    public void runRequestedTeardown(DeploymentLease lease, PendingIntent intent) {
        String id = lease.getDeploymentId();
        Optional<Deployment> found = repository.findById(id);
        if (found.isEmpty()) {
            return;
        }
        Deployment deployment = found.get();
        if (intent == PendingIntent.DELETE) {
            if (!deployment.isDeletionRequested()) {
                transitions.apply(id, LifecycleEvent.DELETE, Deployment::markDeletionRequested, "Deletion requested");
            }
            runDelete(lease);
            return;
        }
        switch (deployment.getStatus()) {
            case PENDING -> {
                transitions.apply(id, LifecycleEvent.SUBMIT, null, "Deploying");
                transitions.apply(id, LifecycleEvent.CANCEL, null, "Stop requested before deployment started");
            }
            case DEPLOYING, SCALING, UPDATING -> transitions.apply(id, LifecycleEvent.CANCEL, null, "Stop requested");
            case RUNNING, ERROR -> transitions.apply(id, LifecycleEvent.STOP, null, "Stop requested");
            case STOPPING -> log.debug("Deployment {} already stopping", id);
            default -> {
                log.info("Deployment {} is {}, stop request ignored", id, deployment.getStatus());
                return;
            }
        }
        runStop(lease);
    }

    /**
     * 진행 중인 작업이 stop/delete 요청을 만났을 때: STOPPING 으로 전이한 뒤 같은 lease 로 정리합니다.
     */
    void handleCancellation(DeploymentLease lease) {
        String id = lease.getDeploymentId();
        PendingIntent intent = lease.acknowledgeCancellation();
        if (intent == null) {
            return;
        }
        log.info("Deployment {}: {} interrupted by {} request, routing to teardown", id, lease.getOperation(), intent);

        Deployment deployment = transitions.load(id);
        if (intent == PendingIntent.DELETE) {
            transitions.apply(id, LifecycleEvent.DELETE, Deployment::markDeletionRequested, "Deletion requested");
            runDelete(lease);
            return;
        }
        LifecycleEvent event = CANCELLABLE_STATES.contains(deployment.getStatus())
                ? LifecycleEvent.CANCEL : LifecycleEvent.STOP;
        transitions.apply(id, event, null, "Stop requested while " + lease.getOperation() + " was in progress");
        runStop(lease);
    }

    private WorkloadStatus awaitReady(DeploymentLease lease, ContainerDriver driver, String handle, int replicas) {
        String id = lease.getDeploymentId();
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        while (true) {
            WorkloadStatus status = retryPolicy.execute(id, "read status of " + handle,
                    () -> driver.getStatus(handle), lease::throwIfCancellationRequested);
            if (status.phase() == WorkloadPhase.FAILED) {
                throw new WorkloadFailedException("Workload " + handle + " failed: " + status.message());
            }
            if (status.phase() == WorkloadPhase.MISSING) {
                throw new WorkloadNotFoundException(handle);
            }
            if (status.isReady(replicas)) {
                return status;
            }
            if (System.nanoTime() >= deadline) {
                throw new DriverTimeoutException(String.format("Workload %s not ready after %ds: %s",
                        handle, readyTimeout.toSeconds(), status.message()));
            }
            log.debug("Deployment {}: waiting for {} ({})", id, handle, status.message());
            retryPolicy.pause(id, readyPollInterval);
        }
    }

    private void awaitAbsent(DeploymentLease lease, ContainerDriver driver, String handle) {
        String id = lease.getDeploymentId();
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        while (true) {
            WorkloadStatus status = retryPolicy.execute(id, "confirm removal of " + handle,
                    () -> driver.getStatus(handle), lease::throwIfCancellationRequested);
            if (!status.exists()) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                throw new DriverTimeoutException("Workload " + handle + " still present after delete: " + status.message());
            }
            retryPolicy.pause(id, readyPollInterval);
        }
    }

    private void fail(DeploymentLease lease, String prefix, DriverException e) {
        lease.throwIfAbandoned();
        String id = lease.getDeploymentId();
        String message = truncate(prefix + ": " + e.getMessage());
        log.error("Deployment {}: {}", id, message);
        transitions.apply(id, LifecycleEvent.FAIL, d -> d.recordError(message), message);
    }

    private static void markRunning(Deployment deployment, WorkloadStatus status) {
        deployment.updateHealth(HealthStatus.HEALTHY);
        deployment.updateEndpointUrl(status.endpointUrl());
        deployment.clearError();
    }

    public static WorkloadSpec toSpec(Deployment deployment) {
        return new WorkloadSpec(
                deployment.workloadName(),
                deployment.getId(),
                deployment.getMcpServerId(),
                deployment.getImageReference(),
                deployment.getReplicaCount(),
                deployment.getCpuLimit(),
                deployment.getMemoryLimit(),
                deployment.getEnvironmentVariables(),
                deployment.getContainerPort(),
                deployment.getHealthCheckPath());
    }

    public static String handleOf(ContainerDriver driver, Deployment deployment) {
        return deployment.getBackendHandle() != null
                ? deployment.getBackendHandle()
                : driver.handleFor(deployment.workloadName());
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
