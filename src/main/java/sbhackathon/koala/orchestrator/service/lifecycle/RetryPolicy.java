package sbhackathon.koala.orchestrator.service.lifecycle;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.service.task.OperationAbandonedException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff around a single driver call.
 * <p>
 * Only errors whose {@link DriverException#isRetryable()} is true are retried, exactly
 * {@code maxRetries} times; the next failure raises {@link RetriesExhaustedException}.
 * The checkpoint runs before every attempt so a cancelled operation stops between retries.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final BackoffSleeper sleeper;

    public RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier,
                       Duration maxBackoff, BackoffSleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public <T> T execute(String deploymentId, String action, Supplier<T> call, Runnable checkpoint) {
        for (int retry = 0; ; retry++) {
            checkpoint.run();
            try {
                return call.get();
            } catch (DriverException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new OperationAbandonedException(deploymentId, e);
                }
                if (!e.isRetryable()) {
                    throw e;
                }
                if (retry >= maxRetries) {
                    log.warn("Deployment {}: {} failed after {} retries: {}", deploymentId, action, maxRetries, e.getMessage());
                    throw new RetriesExhaustedException(action, maxRetries, e);
                }
                Duration backoff = backoffFor(retry);
                log.warn("Deployment {}: {} failed ({}), retry {}/{} in {} ms",
                        deploymentId, action, e.getMessage(), retry + 1, maxRetries, backoff.toMillis());
                pause(deploymentId, backoff);
            }
        }
    }

    public void run(String deploymentId, String action, Runnable call, Runnable checkpoint) {
        execute(deploymentId, action, () -> {
            call.run();
            return null;
        }, checkpoint);
    }

    /**
     * Sleep before retry number {@code retry + 1}: {@code initialBackoff * multiplier^retry}, capped.
     */
    public Duration backoffFor(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retry);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    void pause(String deploymentId, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationAbandonedException(deploymentId, e);
        }
    }
}
