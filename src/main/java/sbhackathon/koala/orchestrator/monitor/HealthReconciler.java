package sbhackathon.koala.orchestrator.monitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.entity.HealthStatus;
import sbhackathon.koala.orchestrator.event.DeploymentStatusPublisher;
import sbhackathon.koala.orchestrator.exception.StaleDeploymentException;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriverRegistry;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;
import sbhackathon.koala.orchestrator.service.lifecycle.DeploymentOperations;
import sbhackathon.koala.orchestrator.service.lifecycle.DeploymentTransitions;
import sbhackathon.koala.orchestrator.service.lifecycle.LifecycleEvent;
import sbhackathon.koala.orchestrator.service.task.DeploymentLease;
import sbhackathon.koala.orchestrator.service.task.DeploymentLeaseRegistry;
import sbhackathon.koala.orchestrator.service.task.DeploymentTaskExecutor;
import sbhackathon.koala.orchestrator.service.task.OperationType;
import sbhackathon.koala.orchestrator.service.task.PendingIntent;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * One reconciliation pass for one deployment: compares the record with what the backend
 * reports and either records the observed health or hands corrective work to the task pool.
 * <p>
 * The backend is read without holding the lease, so stop and delete requests are never
 * refused because a health check is waiting on the network. The pass never writes while
 * another operation holds the lease; its own writes happen under a short
 * {@link OperationType#RECONCILE} lease, and an observation made against a record that has
 * since changed is dropped. The next pass observes again.
 */
@Slf4j
@Component
public class HealthReconciler {

    private final DeploymentRepository repository;
    private final DeploymentLeaseRegistry leases;
    private final DeploymentTaskExecutor taskExecutor;
    private final DeploymentOperations operations;
    private final DeploymentTransitions transitions;
    private final DeploymentStatusPublisher publisher;
    private final ContainerDriverRegistry drivers;
    private final int maxRecoveryAttempts;

    private final Map<String, Integer> mismatches = new ConcurrentHashMap<>();

    public HealthReconciler(DeploymentRepository repository,
                            DeploymentLeaseRegistry leases,
                            DeploymentTaskExecutor taskExecutor,
                            DeploymentOperations operations,
                            DeploymentTransitions transitions,
                            DeploymentStatusPublisher publisher,
                            ContainerDriverRegistry drivers,
                            OrchestratorProperties properties) {
        this.repository = repository;
        this.leases = leases;
        this.taskExecutor = taskExecutor;
        this.operations = operations;
        this.transitions = transitions;
        this.publisher = publisher;
        this.drivers = drivers;
        this.maxRecoveryAttempts = properties.getHealth().getMaxRecoveryAttempts();
    }

    public ReconcileOutcome reconcile(String deploymentId) {
        if (leases.isHeld(deploymentId)) {
            log.debug("Deployment {} busy, skipping health pass", deploymentId);
            return ReconcileOutcome.CONTINUE;
        }
        Optional<Deployment> found = repository.findById(deploymentId);
        if (found.isEmpty()) {
            mismatches.remove(deploymentId);
            leases.takeUnhandledIntent(deploymentId);
            return ReconcileOutcome.STOP_WATCHING;
        }

        Deployment deployment = found.get();
        Optional<PendingIntent> unhandled = leases.takeUnhandledIntent(deploymentId);
        if (unhandled.isPresent()) {
            resumeTeardown(deployment, unhandled.get());
            return ReconcileOutcome.CONTINUE;
        }
        if (deployment.getStatus().isTerminal()) {
            mismatches.remove(deploymentId);
            return ReconcileOutcome.STOP_WATCHING;
        }

        switch (deployment.getStatus()) {
            case PENDING, DEPLOYING -> resubmit(deploymentId, OperationType.DEPLOY, deployment);
            case SCALING -> resubmit(deploymentId, OperationType.SCALE, deployment);
            case UPDATING -> resubmit(deploymentId, OperationType.UPDATE, deployment);
            case STOPPING -> resubmit(deploymentId,
                    deployment.isDeletionRequested() ? OperationType.DELETE : OperationType.STOP, deployment);
            case RUNNING -> reconcileRunning(deployment);
            case ERROR -> reconcileError(deployment);
            default -> log.debug("Deployment {} is {}, nothing to reconcile", deploymentId, deployment.getStatus());
        }
        return ReconcileOutcome.CONTINUE;
    }

    /**
     * 작업 도중 중단된(예: 재시작) 중간 상태를 다시 작업 풀에 넣습니다.
     */
    private void resubmit(String deploymentId, OperationType operation, Deployment deployment) {
        boolean submitted = taskExecutor.trySubmit(deploymentId, operation, lease -> {
            switch (operation) {
                case DEPLOY -> operations.runDeploy(lease);
                case SCALE -> operations.runScale(lease);
                case UPDATE -> operations.runUpdate(lease);
                case STOP -> operations.runStop(lease);
                case DELETE -> operations.runDelete(lease);
                default -> throw new IllegalArgumentException("Not a resumable operation: " + operation);
            }
        });
        if (submitted) {
            log.info("Deployment {} found abandoned in {}, resubmitted {}", deploymentId, deployment.getStatus(), operation);
        }
    }

    /**
     * 접수됐지만 작업이 처리하지 못하고 끝난 stop/delete 요청을 이어서 실행합니다.
     */
    private void resumeTeardown(Deployment deployment, PendingIntent intent) {
        String deploymentId = deployment.getId();
        OperationType operation = intent == PendingIntent.DELETE ? OperationType.DELETE : OperationType.STOP;
        if (taskExecutor.trySubmit(deploymentId, operation, lease -> operations.runRequestedTeardown(lease, intent))) {
            log.info("Deployment {}: {} request left unhandled in {}, resubmitted", deploymentId, intent, deployment.getStatus());
        } else {
            leases.deferIntent(deploymentId, intent);
        }
    }

    /**
     * 백엔드 조회는 lease 없이 수행하고, 결과 기록만 짧은 RECONCILE lease 아래에서 합니다.
     * 조회하는 동안 레코드가 바뀌었으면 관측 결과는 버립니다.
     */
    private void reconcileRunning(Deployment snapshot) {
        String deploymentId = snapshot.getId();
        WorkloadStatus status = observe(snapshot);

        boolean recover = underReconcileLease(snapshot, deployment -> {
            if (status == null) {
                writeHealth(deployment, HealthStatus.UNKNOWN, "Backend unreachable");
                return false;
            }
            int desired = deployment.getReplicaCount();
            if (status.isReady(desired)) {
                mismatches.remove(deploymentId);
                writeHealth(deployment, HealthStatus.HEALTHY, "All " + desired + " replica(s) ready");
                return false;
            }

            HealthStatus observed = status.replicasReady() > 0 ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
            int attempts = mismatches.merge(deploymentId, 1, Integer::sum);
            String detail = String.format("%d/%d replica(s) ready: %s", status.replicasReady(), desired, status.message());
            if (attempts > maxRecoveryAttempts) {
                mismatches.remove(deploymentId);
                exhaust(deploymentId, detail);
                return false;
            }
            log.warn("Deployment {} {} ({}), recovery attempt {}/{}",
                    deploymentId, observed, detail, attempts, maxRecoveryAttempts);
            writeHealth(deployment, observed, detail);
            return true;
        });

        if (recover && !taskExecutor.trySubmit(deploymentId, OperationType.RECOVER, operations::runRecovery)) {
            log.debug("Deployment {}: recovery not submitted, will retry on next pass", deploymentId);
        }
    }

    private void reconcileError(Deployment snapshot) {
        WorkloadStatus status = observe(snapshot);
        underReconcileLease(snapshot, deployment -> {
            HealthStatus observed;
            if (status == null) {
                observed = HealthStatus.UNKNOWN;
            } else if (status.isReady(deployment.getReplicaCount())) {
                observed = HealthStatus.HEALTHY;
            } else {
                observed = status.replicasReady() > 0 ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
            }
            writeHealth(deployment, observed, "Health observed while in ERROR");
            return false;
        });
    }

    /**
     * Runs {@code write} on a fresh copy of the record under a RECONCILE lease, provided the
     * record still has the status and version the observation was made against.
     *
     * @return the write's result, or {@code false} if the observation was dropped
     */
    private boolean underReconcileLease(Deployment snapshot, Predicate<Deployment> write) {
        String deploymentId = snapshot.getId();
        Optional<DeploymentLease> acquired = leases.tryAcquire(deploymentId, OperationType.RECONCILE);
        if (acquired.isEmpty()) {
            log.debug("Deployment {}: operation started during health check, observation dropped", deploymentId);
            return false;
        }
        try {
            Deployment current = repository.findById(deploymentId).orElse(null);
            if (current == null || current.getStatus() != snapshot.getStatus()
                    || !Objects.equals(current.getVersion(), snapshot.getVersion())) {
                log.debug("Deployment {}: record changed during health check, observation dropped", deploymentId);
                return false;
            }
            return write.test(current);
        } finally {
            leases.release(acquired.get());
        }
    }

    private WorkloadStatus observe(Deployment deployment) {
        try {
            ContainerDriver driver = drivers.driverFor(deployment.getBackendType());
            return driver.getStatus(DeploymentOperations.handleOf(driver, deployment));
        } catch (DriverException e) {
            log.warn("Deployment {}: health check failed: {}", deployment.getId(), e.getMessage());
            return null;
        }
    }

    private void exhaust(String deploymentId, String detail) {
        String message = "Recovery attempts exhausted after " + maxRecoveryAttempts + " tries: " + detail;
        log.error("Deployment {}: {}", deploymentId, message);
        try {
            transitions.apply(deploymentId, LifecycleEvent.RECOVERY_EXHAUSTED, d -> {
                d.updateHealth(HealthStatus.UNHEALTHY);
                d.recordError(message);
            }, message);
        } catch (StaleDeploymentException e) {
            log.debug("Deployment {}: exhaustion write lost to a concurrent update", deploymentId);
        }
    }

    private void writeHealth(Deployment deployment, HealthStatus health, String message) {
        if (deployment.getHealth() == health) {
            return;
        }
        HealthStatus previous = deployment.getHealth();
        deployment.updateHealth(health);
        try {
            publisher.publish(deployment, message);
            log.info("Deployment {} health {} -> {}", deployment.getId(), previous, health);
        } catch (StaleDeploymentException e) {
            log.debug("Deployment {}: health write discarded, record changed concurrently", deployment.getId());
        }
    }

    int recoveryAttempts(String deploymentId) {
        return mismatches.getOrDefault(deploymentId, 0);
    }
}
