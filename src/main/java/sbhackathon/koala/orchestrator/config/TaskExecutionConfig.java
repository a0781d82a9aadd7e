package sbhackathon.koala.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import sbhackathon.koala.orchestrator.service.lifecycle.BackoffSleeper;
import sbhackathon.koala.orchestrator.service.lifecycle.RetryPolicy;

/**
 * 배포 작업 풀, 헬스 체크 스케줄러, 이벤트 전달 풀을 명시적인 빈으로 등록합니다.
 * {@code @EnableAsync}/{@code @Scheduled} 는 사용하지 않습니다.
 */
@Configuration
public class TaskExecutionConfig {

    private final OrchestratorProperties properties;

    public TaskExecutionConfig(OrchestratorProperties properties) {
        this.properties = properties;
    }

    /**
     * 배포/시작/중지/스케일/삭제 작업을 실행하는 풀.
     * 종료 시 drain 과 중단은 {@code DeploymentTaskExecutor} 가 처리합니다.
     */
    @Bean(name = "deploymentTaskPool")
    public ThreadPoolTaskExecutor deploymentTaskPool() {
        OrchestratorProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("Deployment-");
        executor.setDaemon(true);
        // context 종료 이벤트에서 바로 shutdown 하지 않도록 유지
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean(name = "healthCheckScheduler")
    public ThreadPoolTaskScheduler healthCheckScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getHealth().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("HealthCheck-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "eventDispatchExecutor")
    public ThreadPoolTaskExecutor eventDispatchExecutor() {
        int poolSize = properties.getEvents().getDispatcherPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("EventDispatch-");
        executor.setDaemon(true);
        return executor;
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean
    public RetryPolicy retryPolicy(BackoffSleeper backoffSleeper) {
        OrchestratorProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxRetries(), retry.getInitialBackoff(),
                retry.getMultiplier(), retry.getMaxBackoff(), backoffSleeper);
    }
}
