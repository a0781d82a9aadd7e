package sbhackathon.koala.orchestrator.support;

import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadPhase;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadSpec;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory backend for end-to-end tests. Workloads become ready as soon as they are started
 * unless a test overrides the ready count; failures and pauses can be scripted per operation.
 */
public class FakeContainerDriver implements ContainerDriver {

    public static final String CREATE = "create";
    public static final String START = "start";
    public static final String STOP = "stop";
    public static final String SCALE = "scale";
    public static final String UPDATE = "update";
    public static final String DELETE = "delete";
    public static final String STATUS = "getStatus";

    private final Map<String, Workload> workloads = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, DriverException> alwaysFail = new ConcurrentHashMap<>();
    private final Map<String, Gate> gates = new ConcurrentHashMap<>();

    @Override
    public BackendType backendType() {
        return BackendType.DOCKER;
    }

    @Override
    public String create(WorkloadSpec spec) {
        enter(CREATE);
        spec.validate();
        workloads.computeIfAbsent(spec.name(), name -> new Workload(spec));
        return spec.name();
    }

    @Override
    public void start(String handle) {
        enter(START);
        require(handle).running = true;
    }

    @Override
    public void stop(String handle) {
        enter(STOP);
        require(handle).running = false;
    }

    @Override
    public void scale(String handle, int replicas) {
        enter(SCALE);
        require(handle).replicas = replicas;
    }

    @Override
    public void update(String handle, WorkloadSpec spec) {
        enter(UPDATE);
        Workload workload = require(handle);
        workload.spec = spec;
        workload.replicas = spec.replicas();
    }

    @Override
    public void delete(String handle) {
        enter(DELETE);
        workloads.remove(handle);
    }

    @Override
    public WorkloadStatus getStatus(String handle) {
        enter(STATUS);
        Workload workload = workloads.get(handle);
        if (workload == null) {
            return WorkloadStatus.missing(handle);
        }
        if (workload.failed) {
            return new WorkloadStatus(WorkloadPhase.FAILED, workload.replicas, 0, "crash loop", null);
        }
        if (!workload.running) {
            return new WorkloadStatus(WorkloadPhase.STOPPED, workload.replicas, 0, "stopped", null);
        }
        int ready = workload.readyOverride != null ? workload.readyOverride : workload.replicas;
        WorkloadPhase phase = ready >= workload.replicas ? WorkloadPhase.RUNNING : WorkloadPhase.PROGRESSING;
        return new WorkloadStatus(phase, workload.replicas, ready, ready + "/" + workload.replicas + " ready",
                "http://" + handle + ":" + workload.spec.containerPort());
    }

    @Override
    public void streamLogs(String handle, int tailLines, Consumer<String> sink) {
        require(handle);
        for (int i = 0; i < Math.min(tailLines, 3); i++) {
            sink.accept(handle + " log line " + i);
        }
    }

    public void failAlways(String operation, DriverException error) {
        alwaysFail.put(operation, error);
    }

    /**
     * Makes the next call to {@code operation} block until {@link Gate#release()}.
     */
    public Gate pauseOn(String operation) {
        Gate gate = new Gate();
        gates.put(operation, gate);
        return gate;
    }

    public void setReadyReplicas(String handle, Integer ready) {
        require(handle).readyOverride = ready;
    }

    public void markFailed(String handle) {
        require(handle).failed = true;
    }

    /**
     * Simulates the workload disappearing behind the orchestrator's back.
     */
    public void lose(String handle) {
        workloads.remove(handle);
    }

    public boolean exists(String handle) {
        return workloads.containsKey(handle);
    }

    public int replicas(String handle) {
        return require(handle).replicas;
    }

    public boolean isRunning(String handle) {
        return require(handle).running;
    }

    public int workloadCount() {
        return workloads.size();
    }

    public int callCount(String operation) {
        AtomicInteger counter = calls.get(operation);
        return counter != null ? counter.get() : 0;
    }

    public List<String> handles() {
        return new ArrayList<>(workloads.keySet());
    }

    public void reset() {
        workloads.clear();
        calls.clear();
        alwaysFail.clear();
        gates.values().forEach(Gate::release);
        gates.clear();
    }

    private void enter(String operation) {
        calls.computeIfAbsent(operation, key -> new AtomicInteger()).incrementAndGet();
        Gate gate = gates.remove(operation);
        if (gate != null) {
            gate.hold();
        }
        DriverException error = alwaysFail.get(operation);
        if (error != null) {
            throw error;
        }
    }

    private Workload require(String handle) {
        Workload workload = workloads.get(handle);
        if (workload == null) {
            throw new WorkloadNotFoundException(handle);
        }
        return workload;
    }

    private static final class Workload {
        private volatile WorkloadSpec spec;
        private volatile int replicas;
        private volatile boolean running;
        private volatile boolean failed;
        private volatile Integer readyOverride;

        private Workload(WorkloadSpec spec) {
            this.spec = spec;
            this.replicas = spec.replicas();
        }
    }

    public static final class Gate {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);

        public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
            return entered.await(timeout, unit);
        }

        public void release() {
            released.countDown();
        }

        private void hold() {
            entered.countDown();
            try {
                released.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
