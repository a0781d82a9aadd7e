package sbhackathon.koala.orchestrator.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fan-out of {@link DeploymentEvent}s to registered subscribers.
 * <p>
 * {@link #publish} only appends to each matching subscriber's bounded buffer and returns.
 * When a buffer is full its oldest event is dropped. Every subscriber is drained by at most
 * one dispatch task at a time on the {@code eventDispatchExecutor}, so a slow or failing
 * listener delays only itself.
 */
@Slf4j
@Component
public class DeploymentEventStream implements DisposableBean {

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Executor dispatcher;
    private final int bufferSize;

    private volatile boolean closed;

    @Autowired
    public DeploymentEventStream(@Qualifier("eventDispatchExecutor") Executor dispatcher,
                                 OrchestratorProperties properties) {
        this(dispatcher, properties.getEvents().getBufferSize());
    }

    DeploymentEventStream(Executor dispatcher, int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.dispatcher = dispatcher;
        this.bufferSize = bufferSize;
    }

    public void subscribe(String subscriberId, Predicate<DeploymentEvent> filter, Consumer<DeploymentEvent> listener) {
        if (closed) {
            throw new IllegalStateException("Event stream is closed");
        }
        Subscription previous = subscriptions.put(subscriberId, new Subscription(subscriberId, filter, listener));
        if (previous != null) {
            previous.cancel();
        }
        log.debug("Subscriber {} registered ({} active)", subscriberId, subscriptions.size());
    }

    public void subscribe(String subscriberId, Consumer<DeploymentEvent> listener) {
        subscribe(subscriberId, event -> true, listener);
    }

    public void unsubscribe(String subscriberId) {
        Subscription removed = subscriptions.remove(subscriberId);
        if (removed != null) {
            removed.cancel();
            log.debug("Subscriber {} removed ({} dropped event(s))", subscriberId, removed.dropped.get());
        }
    }

    public void publish(DeploymentEvent event) {
        if (closed) {
            return;
        }
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.accepts(event)) {
                subscription.offer(event);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public long droppedCount(String subscriberId) {
        Subscription subscription = subscriptions.get(subscriberId);
        return subscription != null ? subscription.dropped.get() : 0L;
    }

    @Override
    public void destroy() {
        closed = true;
        subscriptions.values().forEach(Subscription::cancel);
        subscriptions.clear();
        log.info("Deployment event stream closed");
    }

    private final class Subscription {

        private final String id;
        private final Predicate<DeploymentEvent> filter;
        private final Consumer<DeploymentEvent> listener;
        private final Deque<DeploymentEvent> buffer = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicLong dropped = new AtomicLong();
        private volatile boolean active = true;

        private Subscription(String id, Predicate<DeploymentEvent> filter, Consumer<DeploymentEvent> listener) {
            this.id = id;
            this.filter = filter;
            this.listener = listener;
        }

        private boolean accepts(DeploymentEvent event) {
            try {
                return active && filter.test(event);
            } catch (RuntimeException e) {
                log.warn("Filter of subscriber {} failed: {}", id, e.getMessage());
                return false;
            }
        }

        private void offer(DeploymentEvent event) {
            synchronized (buffer) {
                if (buffer.size() >= bufferSize) {
                    buffer.pollFirst();
                    long total = dropped.incrementAndGet();
                    log.debug("Subscriber {} buffer full, dropped oldest event ({} total)", id, total);
                }
                buffer.addLast(event);
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!active || !draining.compareAndSet(false, true)) {
                return;
            }
            try {
                dispatcher.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("Dispatch for subscriber {} rejected, events stay buffered: {}", id, e.getMessage());
            }
        }

        private void drain() {
            try {
                DeploymentEvent next;
                while (active && (next = poll()) != null) {
                    deliver(next);
                }
            } finally {
                draining.set(false);
            }
            if (active && hasPending()) {
                scheduleDrain();
            }
        }

        private void deliver(DeploymentEvent event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber {} failed to handle event for deployment {}: {}",
                        id, event.deploymentId(), e.getMessage());
            }
        }

        private DeploymentEvent poll() {
            synchronized (buffer) {
                return buffer.pollFirst();
            }
        }

        private boolean hasPending() {
            synchronized (buffer) {
                return !buffer.isEmpty();
            }
        }

        private void cancel() {
            active = false;
            synchronized (buffer) {
                buffer.clear();
            }
        }
    }
}
