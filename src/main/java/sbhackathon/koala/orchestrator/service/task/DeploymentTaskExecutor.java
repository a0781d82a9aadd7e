package sbhackathon.koala.orchestrator.service.task;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.exception.DeploymentBusyException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs mutating operations on the bounded {@code deploymentTaskPool}, one per
 * deployment id at a time.
 * <p>
 * The lease is acquired on the caller's thread, so a second request for the same id fails
 * immediately with {@link DeploymentBusyException}. The task releases it when it finishes,
 * whatever the outcome. Exceptions never escape a task.
 * <p>
 * On shutdown the pool stops taking work and running tasks get {@code drain-timeout} to
 * finish. Tasks still running after that are abandoned: they are interrupted and stop at
 * their next checkpoint without writing, leaving the last persisted interim state.
 */
@Slf4j
@Component
public class DeploymentTaskExecutor implements DisposableBean {

    private final DeploymentLeaseRegistry leases;
    private final TaskExecutor pool;
    private final Duration drainTimeout;

    private volatile boolean shuttingDown;

    public DeploymentTaskExecutor(DeploymentLeaseRegistry leases,
                                  @Qualifier("deploymentTaskPool") TaskExecutor pool,
                                  OrchestratorProperties properties) {
        this.leases = leases;
        this.pool = pool;
        this.drainTimeout = properties.getExecutor().getDrainTimeout();
    }

    /**
     * Acquires the lease, runs {@code prepare} synchronously under it (typically persisting the
     * interim state), then hands {@code work} to the pool.
     * <p>
     * If the pool rejects the task the lease is released and the prepared state is returned
     * anyway: the record stays in its interim state and the health monitor resubmits it.
     *
     * @throws DeploymentBusyException if another operation holds the lease
     */
    public <T> T submit(String deploymentId, OperationType operation,
                        Function<DeploymentLease, T> prepare, Consumer<DeploymentLease> work) {
        if (shuttingDown) {
            throw new DeploymentBusyException("Orchestrator is shutting down, " + operation + " rejected");
        }
        DeploymentLease lease = leases.tryAcquire(deploymentId, operation)
                .orElseThrow(() -> new DeploymentBusyException("Deployment " + deploymentId
                        + " already has an operation in progress"));

        T prepared;
        try {
            prepared = prepare.apply(lease);
        } catch (RuntimeException e) {
            leases.release(lease);
            throw e;
        }

        if (!dispatch(lease, work)) {
            log.warn("Task pool saturated, {} for deployment {} left for reconciliation", operation, deploymentId);
        }
        return prepared;
    }

    public void submit(String deploymentId, OperationType operation, Consumer<DeploymentLease> work) {
        submit(deploymentId, operation, lease -> null, work);
    }

    /**
     * Non-throwing variant used by the health monitor.
     *
     * @return {@code false} if the lease is held or the pool is saturated
     */
    public boolean trySubmit(String deploymentId, OperationType operation, Consumer<DeploymentLease> work) {
        if (shuttingDown) {
            return false;
        }
        return leases.tryAcquire(deploymentId, operation)
                .map(lease -> dispatch(lease, work))
                .orElse(false);
    }

    private boolean dispatch(DeploymentLease lease, Consumer<DeploymentLease> work) {
        try {
            pool.execute(() -> run(lease, work));
            return true;
        } catch (TaskRejectedException e) {
            leases.release(lease);
            return false;
        }
    }

    private void run(DeploymentLease lease, Consumer<DeploymentLease> work) {
        log.debug("Running {} for deployment {}", lease.getOperation(), lease.getDeploymentId());
        try {
            work.accept(lease);
        } catch (OperationAbandonedException e) {
            log.warn("{} for deployment {} abandoned; last persisted state kept for reconciliation",
                    lease.getOperation(), lease.getDeploymentId());
        } catch (RuntimeException e) {
            log.error("{} for deployment {} failed unexpectedly: {}",
                    lease.getOperation(), lease.getDeploymentId(), e.getMessage(), e);
        } finally {
            leases.release(lease);
        }
    }

    @Override
    public void destroy() {
        shuttingDown = true;
        log.info("Deployment task executor closed for new work ({} lease(s) active)", leases.activeCount());
        if (pool instanceof ThreadPoolTaskExecutor) {
            drain(((ThreadPoolTaskExecutor) pool).getThreadPoolExecutor());
        }
    }

    private void drain(ThreadPoolExecutor executor) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        leases.abandonAll();
        List<Runnable> dropped = executor.shutdownNow();
        log.warn("배포 작업 drain 시간 초과 ({}s): lease {}건 중단, 대기 작업 {}건 폐기",
                drainTimeout.toSeconds(), leases.activeCount(), dropped.size());
    }
}
