package sbhackathon.koala.orchestrator.service.task;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.exception.DeploymentBusyException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DeploymentTaskExecutorTest {

    private final DeploymentLeaseRegistry leases = new DeploymentLeaseRegistry();
    private ThreadPoolTaskExecutor pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void 작업이_끝나면_lease를_해제한다() {
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, new SyncTaskExecutor(), new OrchestratorProperties());
        AtomicReference<DeploymentLease> seen = new AtomicReference<>();

        String prepared = executor.submit("d-1", OperationType.DEPLOY, lease -> "PENDING", seen::set);

        assertThat(prepared).isEqualTo("PENDING");
        assertThat(seen.get().getOperation()).isEqualTo(OperationType.DEPLOY);
        assertThat(leases.isHeld("d-1")).isFalse();
    }

    @Test
    void 진행_중인_작업이_있으면_Busy() throws Exception {
        pool = startPool();
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, pool, new OrchestratorProperties());
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);

        executor.submit("d-1", OperationType.SCALE, lease -> {
            running.countDown();
            awaitQuietly(finish);
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> executor.submit("d-1", OperationType.UPDATE, lease -> { }))
                .isInstanceOf(DeploymentBusyException.class);
        assertThat(executor.trySubmit("d-1", OperationType.RECOVER, lease -> { })).isFalse();

        finish.countDown();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !leases.isHeld("d-1"));
        assertThat(executor.trySubmit("d-1", OperationType.RECOVER, lease -> { })).isTrue();
    }

    @Test
    void 준비_단계가_실패하면_lease를_해제하고_예외를_전달한다() {
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, new SyncTaskExecutor(), new OrchestratorProperties());
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> executor.submit("d-1", OperationType.SCALE,
                lease -> {
                    throw new IllegalStateException("transition rejected");
                },
                lease -> ran.set(true)))
                .isInstanceOf(IllegalStateException.class);

        assertThat(ran).isFalse();
        assertThat(leases.isHeld("d-1")).isFalse();
    }

    @Test
    void 작업_예외는_전파되지_않고_lease가_해제된다() {
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, new SyncTaskExecutor(), new OrchestratorProperties());

        executor.submit("d-1", OperationType.DEPLOY, lease -> {
            throw new IllegalStateException("boom");
        });
        executor.submit("d-1", OperationType.DEPLOY, lease -> {
            throw new OperationAbandonedException("d-1", null);
        });

        assertThat(leases.isHeld("d-1")).isFalse();
    }

    @Test
    void 풀이_가득_차면_lease를_해제하고_준비된_상태를_반환한다() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, saturated, new OrchestratorProperties());

        String prepared = executor.submit("d-1", OperationType.DEPLOY, lease -> "PENDING", lease -> { });

        assertThat(prepared).isEqualTo("PENDING");
        assertThat(leases.isHeld("d-1")).isFalse();
        assertThat(executor.trySubmit("d-1", OperationType.DEPLOY, lease -> { })).isFalse();
        assertThat(leases.isHeld("d-1")).isFalse();
    }

    @Test
    void 종료_중에는_새_작업을_받지_않는다() {
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, new SyncTaskExecutor(), new OrchestratorProperties());
        executor.destroy();

        assertThatThrownBy(() -> executor.submit("d-1", OperationType.DEPLOY, lease -> { }))
                .isInstanceOf(DeploymentBusyException.class);
        assertThat(executor.trySubmit("d-1", OperationType.RECOVER, lease -> { })).isFalse();
    }

    @Test
    void 풀이_거부한_작업에_남은_stop_요청은_보관된다() {
        // given
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, saturated, new OrchestratorProperties());

        // when: 준비 단계와 제출 사이에 stop 요청이 들어온 경우
        executor.submit("d-1", OperationType.DEPLOY,
                lease -> leases.requestCancellation("d-1", PendingIntent.STOP),
                lease -> { });

        // then
        assertThat(leases.isHeld("d-1")).isFalse();
        assertThat(leases.takeUnhandledIntent("d-1")).contains(PendingIntent.STOP);
        assertThat(leases.takeUnhandledIntent("d-1")).isEmpty();
    }

    @Test
    void 종료_시_drain_시간_안에_끝난_작업은_정상_완료된다() throws Exception {
        // given
        pool = startPool();
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, pool, propertiesWithDrain(Duration.ofSeconds(5)));
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean completed = new AtomicBoolean();
        executor.submit("d-1", OperationType.DEPLOY, lease -> {
            running.countDown();
            sleepQuietly(200);
            lease.throwIfAbandoned();
            completed.set(true);
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        executor.destroy();

        // then
        assertThat(completed).isTrue();
        assertThat(leases.isHeld("d-1")).isFalse();
    }

    @Test
    void 종료_시_drain_시간을_넘긴_작업은_결과를_기록하지_않고_중단된다() throws Exception {
        // given: readiness 대기처럼 checkpoint 사이에 잠드는 작업
        pool = startPool();
        DeploymentTaskExecutor executor = new DeploymentTaskExecutor(leases, pool, propertiesWithDrain(Duration.ofMillis(100)));
        CountDownLatch running = new CountDownLatch(1);
        AtomicBoolean outcomeWritten = new AtomicBoolean();
        AtomicReference<DeploymentLease> held = new AtomicReference<>();
        executor.submit("d-1", OperationType.DEPLOY, lease -> {
            held.set(lease);
            running.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
            while (System.nanoTime() < deadline) {
                lease.throwIfCancellationRequested();
                sleepQuietly(20);
            }
            lease.throwIfAbandoned();
            outcomeWritten.set(true);
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        executor.destroy();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> !leases.isHeld("d-1"));
        assertThat(outcomeWritten).isFalse();
        assertThat(held.get().isAbandoned()).isTrue();
        assertThat(leases.takeUnhandledIntent("d-1")).isEmpty();
    }

    private static OrchestratorProperties propertiesWithDrain(Duration drainTimeout) {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getExecutor().setDrainTimeout(drainTimeout);
        return properties;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadPoolTaskExecutor startPool() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("test-deployment-");
        executor.initialize();
        return executor;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
