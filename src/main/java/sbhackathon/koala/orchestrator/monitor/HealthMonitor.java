package sbhackathon.koala.orchestrator.monitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 배포별 헬스 체크 타이머를 관리합니다.
 * <p>
 * 감시 중인 배포마다 {@code healthCheckIntervalSeconds} 간격의 fixed-delay 작업이
 * {@code healthCheckScheduler} 에 등록되고, 매 회차마다 {@link HealthReconciler} 를 호출합니다.
 * 애플리케이션 시작 시 종료 상태가 아닌 모든 배포를 즉시 한 번 점검합니다.
 */
@Slf4j
@Component
public class HealthMonitor implements DisposableBean {

    private final TaskScheduler scheduler;
    private final HealthReconciler reconciler;
    private final DeploymentRepository repository;

    private final Map<String, Watch> watches = new ConcurrentHashMap<>();

    public HealthMonitor(@Qualifier("healthCheckScheduler") TaskScheduler scheduler,
                         HealthReconciler reconciler,
                         DeploymentRepository repository) {
        this.scheduler = scheduler;
        this.reconciler = reconciler;
        this.repository = repository;
    }

    /**
     * 배포를 감시 대상으로 등록합니다. 이미 감시 중이면 새 주기로 다시 등록합니다.
     *
     * @param immediate true 면 첫 점검을 바로 실행하고, false 면 한 주기 뒤에 실행합니다
     */
    public void watch(String deploymentId, int intervalSeconds, boolean immediate) {
        watches.compute(deploymentId, (id, existing) -> {
            if (existing != null) {
                existing.cancel();
            }
            Watch watch = new Watch(id, intervalSeconds);
            Instant firstRun = immediate ? Instant.now() : Instant.now().plusSeconds(intervalSeconds);
            watch.future = scheduler.scheduleWithFixedDelay(watch, firstRun, Duration.ofSeconds(intervalSeconds));
            return watch;
        });
        log.debug("Watching deployment {} every {}s", deploymentId, intervalSeconds);
    }

    public void watch(Deployment deployment) {
        watch(deployment.getId(), deployment.getHealthCheckIntervalSeconds(), false);
    }

    public void unwatch(String deploymentId) {
        Watch watch = watches.remove(deploymentId);
        if (watch != null) {
            watch.cancel();
            log.debug("Stopped watching deployment {}", deploymentId);
        }
    }

    public boolean isWatching(String deploymentId) {
        return watches.containsKey(deploymentId);
    }

    public int watchCount() {
        return watches.size();
    }

    /**
     * 재시작 후 복구: 저장된 비종료 배포를 모두 다시 감시하며 즉시 점검합니다.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeWatching() {
        List<Deployment> live = repository.findByStatusNotIn(EnumSet.of(DeploymentStatus.STOPPED, DeploymentStatus.FAILED));
        for (Deployment deployment : live) {
            watch(deployment.getId(), deployment.getHealthCheckIntervalSeconds(), true);
        }
        log.info("Health monitor resumed watching {} deployment(s)", live.size());
    }

    @Override
    public void destroy() {
        watches.values().forEach(Watch::cancel);
        watches.clear();
    }

    private final class Watch implements Runnable {

        private final String deploymentId;
        private final int intervalSeconds;
        private volatile ScheduledFuture<?> future;

        private Watch(String deploymentId, int intervalSeconds) {
            this.deploymentId = deploymentId;
            this.intervalSeconds = intervalSeconds;
        }

        @Override
        public void run() {
            try {
                if (reconciler.reconcile(deploymentId) == ReconcileOutcome.STOP_WATCHING
                        && watches.remove(deploymentId, this)) {
                    cancel();
                    log.debug("Deployment {} no longer needs watching", deploymentId);
                }
            } catch (RuntimeException e) {
                log.error("Health pass for deployment {} (every {}s) failed: {}",
                        deploymentId, intervalSeconds, e.getMessage(), e);
            }
        }

        private void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
