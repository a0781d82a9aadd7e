package sbhackathon.koala.orchestrator.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private HealthReconciler reconciler;

    @Mock
    private DeploymentRepository repository;

    @Mock
    private ScheduledFuture<?> future;

    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new HealthMonitor(scheduler, reconciler, repository);
    }

    @Test
    void 같은_배포를_다시_감시하면_기존_타이머를_교체한다() {
        // given
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

        // when
        monitor.watch("d-1", 30, false);
        monitor.watch("d-1", 60, false);

        // then
        assertThat(monitor.watchCount()).isEqualTo(1);
        verify(future).cancel(false);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(60)));
    }

    @Test
    void 재조정이_감시_종료를_반환하면_타이머를_해제한다() {
        // given
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(task.capture(), any(Instant.class), any(Duration.class));
        when(reconciler.reconcile("d-1")).thenReturn(ReconcileOutcome.STOP_WATCHING);
        monitor.watch("d-1", 30, true);

        // when
        task.getValue().run();

        // then
        assertThat(monitor.isWatching("d-1")).isFalse();
        verify(future).cancel(false);
    }

    @Test
    void 재조정_중_예외가_나도_감시를_유지한다() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(task.capture(), any(Instant.class), any(Duration.class));
        when(reconciler.reconcile("d-1")).thenThrow(new IllegalStateException("boom"));
        monitor.watch("d-1", 30, true);

        task.getValue().run();

        assertThat(monitor.isWatching("d-1")).isTrue();
    }

    @Test
    void 기동_시_종료되지_않은_배포를_모두_감시한다() {
        // given
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(repository.findByStatusNotIn(anyCollection())).thenReturn(List.of(deployment("d-1"), deployment("d-2")));

        // when
        monitor.resumeWatching();

        // then
        assertThat(monitor.isWatching("d-1")).isTrue();
        assertThat(monitor.isWatching("d-2")).isTrue();
        verify(scheduler, times(2)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void unwatch는_타이머를_취소한다() {
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        monitor.watch("d-1", 30, false);

        monitor.unwatch("d-1");

        assertThat(monitor.isWatching("d-1")).isFalse();
        verify(future).cancel(false);
    }

    private static Deployment deployment(String id) {
        return Deployment.builder()
                .id(id)
                .mcpServerId("weather")
                .name("weather-" + id)
                .environment(DeploymentEnvironment.DEVELOPMENT)
                .replicaCount(1)
                .healthCheckPath("/health")
                .healthCheckIntervalSeconds(30)
                .containerPort(8080)
                .imageReference("localhost:5000/mcp-server-weather:latest")
                .backendType(BackendType.DOCKER)
                .build();
    }
}
