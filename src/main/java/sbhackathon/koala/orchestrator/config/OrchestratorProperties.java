package sbhackathon.koala.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /**
     * 환경(development/staging/production)별 백엔드(docker/kubernetes) 매핑. 기동 시 한 번만 해석됩니다.
     */
    private Map<String, String> backends = new LinkedHashMap<>(Map.of(
            "development", "docker",
            "staging", "docker",
            "production", "docker"));
    private Executor executor = new Executor();
    private Retry retry = new Retry();
    private Deploy deploy = new Deploy();
    private Health health = new Health();
    private Events events = new Events();
    private Images images = new Images();
    private Defaults defaults = new Defaults();

    public Map<String, String> getBackends() {
        return backends;
    }

    public void setBackends(Map<String, String> backends) {
        this.backends = backends;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Deploy getDeploy() {
        return deploy;
    }

    public void setDeploy(Deploy deploy) {
        this.deploy = deploy;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public static class Executor {
        private int corePoolSize = 5;
        private int maxPoolSize = 20;
        private int queueCapacity = 100;
        private Duration drainTimeout = Duration.ofSeconds(60);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Deploy {
        private Duration readyTimeout = Duration.ofSeconds(300);
        private Duration readyPollInterval = Duration.ofSeconds(5);

        public Duration getReadyTimeout() {
            return readyTimeout;
        }

        public void setReadyTimeout(Duration readyTimeout) {
            this.readyTimeout = readyTimeout;
        }

        public Duration getReadyPollInterval() {
            return readyPollInterval;
        }

        public void setReadyPollInterval(Duration readyPollInterval) {
            this.readyPollInterval = readyPollInterval;
        }
    }

    public static class Health {
        private int schedulerPoolSize = 4;
        private int maxRecoveryAttempts = 3;

        public int getSchedulerPoolSize() {
            return schedulerPoolSize;
        }

        public void setSchedulerPoolSize(int schedulerPoolSize) {
            this.schedulerPoolSize = schedulerPoolSize;
        }

        public int getMaxRecoveryAttempts() {
            return maxRecoveryAttempts;
        }

        public void setMaxRecoveryAttempts(int maxRecoveryAttempts) {
            this.maxRecoveryAttempts = maxRecoveryAttempts;
        }
    }

    public static class Events {
        private int bufferSize = 256;
        private int dispatcherPoolSize = 8;
        private long sseTimeoutMillis = 30 * 60 * 1000L;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public int getDispatcherPoolSize() {
            return dispatcherPoolSize;
        }

        public void setDispatcherPoolSize(int dispatcherPoolSize) {
            this.dispatcherPoolSize = dispatcherPoolSize;
        }

        public long getSseTimeoutMillis() {
            return sseTimeoutMillis;
        }

        public void setSseTimeoutMillis(long sseTimeoutMillis) {
            this.sseTimeoutMillis = sseTimeoutMillis;
        }
    }

    public static class Images {
        private String registry = "localhost:5000";
        private String repositoryPrefix = "mcp-server-";
        private String tag = "latest";

        public String getRegistry() {
            return registry;
        }

        public void setRegistry(String registry) {
            this.registry = registry;
        }

        public String getRepositoryPrefix() {
            return repositoryPrefix;
        }

        public void setRepositoryPrefix(String repositoryPrefix) {
            this.repositoryPrefix = repositoryPrefix;
        }

        public String getTag() {
            return tag;
        }

        public void setTag(String tag) {
            this.tag = tag;
        }
    }

    public static class Defaults {
        private String cpuLimit = "500m";
        private String memoryLimit = "512Mi";
        private String healthCheckPath = "/health";
        private int healthCheckIntervalSeconds = 30;
        private int containerPort = 8080;
        private int logTailLines = 100;

        public String getCpuLimit() {
            return cpuLimit;
        }

        public void setCpuLimit(String cpuLimit) {
            this.cpuLimit = cpuLimit;
        }

        public String getMemoryLimit() {
            return memoryLimit;
        }

        public void setMemoryLimit(String memoryLimit) {
            this.memoryLimit = memoryLimit;
        }

        public String getHealthCheckPath() {
            return healthCheckPath;
        }

        public void setHealthCheckPath(String healthCheckPath) {
            this.healthCheckPath = healthCheckPath;
        }

        public int getHealthCheckIntervalSeconds() {
            return healthCheckIntervalSeconds;
        }

        public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
            this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
        }

        public int getContainerPort() {
            return containerPort;
        }

        public void setContainerPort(int containerPort) {
            this.containerPort = containerPort;
        }

        public int getLogTailLines() {
            return logTailLines;
        }

        public void setLogTailLines(int logTailLines) {
            this.logTailLines = logTailLines;
        }
    }
}
