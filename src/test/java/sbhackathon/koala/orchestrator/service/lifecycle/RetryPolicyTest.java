package sbhackathon.koala.orchestrator.service.lifecycle;

import org.junit.jupiter.api.Test;
import sbhackathon.koala.orchestrator.infra.driver.DriverConnectivityException;
import sbhackathon.koala.orchestrator.infra.driver.DriverTimeoutException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceExhaustionException;
import sbhackathon.koala.orchestrator.service.task.OperationAbandonedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), sleeps::add);

    @Test
    void 연결_오류가_계속되면_정확히_N번_재시도하고_대기시간이_증가한다() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryPolicy.execute("d-1", "create workload", () -> {
            attempts.incrementAndGet();
            throw new DriverConnectivityException("connection refused", null);
        }, () -> { }))
                .isInstanceOf(RetriesExhaustedException.class)
                .satisfies(e -> assertThat(((RetriesExhaustedException) e).getRetries()).isEqualTo(3));

        assertThat(attempts.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void 재시도_중_성공하면_결과를_반환한다() {
        AtomicInteger attempts = new AtomicInteger();

        String handle = retryPolicy.execute("d-1", "create workload", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new DriverTimeoutException("timed out");
            }
            return "mcp-weather";
        }, () -> { });

        assertThat(handle).isEqualTo("mcp-weather");
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void 치명적_오류는_재시도하지_않는다() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryPolicy.run("d-1", "create workload", () -> {
            attempts.incrementAndGet();
            throw new InvalidSpecException("bad image");
        }, () -> { })).isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> retryPolicy.run("d-1", "create workload", () -> {
            attempts.incrementAndGet();
            throw new ResourceExhaustionException("quota exceeded", null);
        }, () -> { })).isInstanceOf(ResourceExhaustionException.class);

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void 대기시간은_최대값으로_제한된다() {
        assertThat(retryPolicy.backoffFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(retryPolicy.backoffFor(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(retryPolicy.backoffFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(retryPolicy.backoffFor(10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void 체크포인트는_매_시도_전에_실행된다() {
        AtomicInteger checkpoints = new AtomicInteger();
        AtomicInteger attempts = new AtomicInteger();

        retryPolicy.execute("d-1", "start workload", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DriverConnectivityException("refused", null);
            }
            return null;
        }, checkpoints::incrementAndGet);

        assertThat(checkpoints.get()).isEqualTo(2);
    }

    @Test
    void 대기_중_인터럽트되면_작업을_포기한다() {
        RetryPolicy interrupted = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofSeconds(1), duration -> {
            throw new InterruptedException("shutdown");
        });

        assertThatThrownBy(() -> interrupted.run("d-1", "start workload", () -> {
            throw new DriverConnectivityException("refused", null);
        }, () -> { })).isInstanceOf(OperationAbandonedException.class);

        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void 잘못된_설정은_거부한다() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(1), d -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(1), d -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
