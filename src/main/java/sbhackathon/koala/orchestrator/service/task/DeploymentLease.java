package sbhackathon.koala.orchestrator.service.task;

import lombok.Getter;

import java.time.Instant;
import java.util.Optional;

/**
 * Exclusive right to mutate one deployment. Held by exactly one operation from acquisition
 * until the task that owns it finishes.
 * <p>
 * Stop and delete requests arriving while the lease is held do not wait for it; they leave a
 * {@link PendingIntent} that the running task observes at its next
 * {@link #throwIfCancellationRequested() checkpoint}.
 */
@Getter
public class DeploymentLease {

    private final String deploymentId;
    private final OperationType operation;
    private final Instant acquiredAt;

    private volatile PendingIntent requestedIntent;
    private volatile PendingIntent handledIntent;
    private volatile boolean abandoned;

    DeploymentLease(String deploymentId, OperationType operation) {
        this.deploymentId = deploymentId;
        this.operation = operation;
        this.acquiredAt = Instant.now();
    }

    /**
     * @return {@code true} if the running operation will honour the intent (now or because it
     * is already tearing down for an equal or stronger intent)
     */
    public synchronized boolean requestCancellation(PendingIntent intent) {
        if (handledIntent != null && (handledIntent == PendingIntent.DELETE || intent == PendingIntent.STOP)) {
            return true;
        }
        OperationType effective = handledIntent == PendingIntent.STOP ? OperationType.STOP : operation;
        if (!effective.isCancellableBy(intent)) {
            return false;
        }
        requestedIntent = intent.merge(requestedIntent);
        return true;
    }

    public boolean isCancellationRequested() {
        return requestedIntent != null;
    }

    public Optional<PendingIntent> pendingIntent() {
        return Optional.ofNullable(requestedIntent);
    }

    /**
     * Takes ownership of the pending intent: the caller is now responsible for the teardown.
     * Later requests for the same or a weaker intent are absorbed; a DELETE arriving during a
     * STOP teardown is raised again at the next checkpoint.
     */
    public synchronized PendingIntent acknowledgeCancellation() {
        PendingIntent intent = requestedIntent;
        if (intent != null) {
            handledIntent = intent.merge(handledIntent);
            requestedIntent = null;
        }
        return intent;
    }

    /**
     * Marks the operation as abandoned by shutdown. It stops at its next checkpoint without
     * writing anything, so the record keeps its last persisted interim state.
     */
    void abandon() {
        abandoned = true;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    /**
     * Called right before an operation writes its outcome.
     */
    public void throwIfAbandoned() {
        if (abandoned || Thread.currentThread().isInterrupted()) {
            throw new OperationAbandonedException(deploymentId, null);
        }
    }

    /**
     * Safe point inside a running operation: between driver calls, between retries and
     * while waiting for readiness.
     */
    public void throwIfCancellationRequested() {
        throwIfAbandoned();
        PendingIntent intent = requestedIntent;
        if (intent != null) {
            throw new OperationCancelledException(deploymentId, intent);
        }
    }

    @Override
    public String toString() {
        return "DeploymentLease{" + deploymentId + ", " + operation + ", acquiredAt=" + acquiredAt + "}";
    }
}
