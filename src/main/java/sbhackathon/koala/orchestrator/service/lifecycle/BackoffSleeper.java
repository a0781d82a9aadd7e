package sbhackathon.koala.orchestrator.service.lifecycle;

import java.time.Duration;

/**
 * Blocking pause between retries and readiness polls. Replaced by a recording sleeper in tests.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration duration) throws InterruptedException;
}
