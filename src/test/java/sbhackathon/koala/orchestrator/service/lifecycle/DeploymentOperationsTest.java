package sbhackathon.koala.orchestrator.service.lifecycle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.event.DeploymentStatusPublisher;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriverRegistry;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadPhase;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;
import sbhackathon.koala.orchestrator.service.task.DeploymentLeaseRegistry;
import sbhackathon.koala.orchestrator.service.task.DeploymentTaskExecutor;
import sbhackathon.koala.orchestrator.service.task.OperationType;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeploymentOperationsTest {

    private static final String ID = "d-1";
    private static final String HANDLE = "mcp-weather";

    @Mock
    private ContainerDriverRegistry drivers;

    @Mock
    private ContainerDriver driver;

    @Mock
    private DeploymentTransitions transitions;

    @Mock
    private DeploymentStatusPublisher publisher;

    @Mock
    private DeploymentRepository repository;

    private final DeploymentLeaseRegistry leases = new DeploymentLeaseRegistry();
    private ThreadPoolTaskExecutor pool;
    private DeploymentTaskExecutor taskExecutor;
    private DeploymentOperations operations;
    private Deployment deployment;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getDeploy().setReadyTimeout(Duration.ofSeconds(300));
        properties.getDeploy().setReadyPollInterval(Duration.ofMillis(20));
        properties.getExecutor().setDrainTimeout(Duration.ofMillis(100));

        RetryPolicy retryPolicy = new RetryPolicy(0, Duration.ofMillis(10), 2.0, Duration.ofMillis(100),
                duration -> Thread.sleep(duration.toMillis()));
        operations = new DeploymentOperations(drivers, transitions, publisher, repository, retryPolicy, properties);

        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setThreadNamePrefix("test-deployment-");
        pool.initialize();
        taskExecutor = new DeploymentTaskExecutor(leases, pool, properties);

        deployment = Deployment.builder()
                .id(ID)
                .mcpServerId("weather")
                .name("weather")
                .environment(DeploymentEnvironment.DEVELOPMENT)
                .replicaCount(1)
                .healthCheckPath("/health")
                .healthCheckIntervalSeconds(30)
                .containerPort(8080)
                .imageReference("localhost:5000/mcp-server-weather:latest")
                .backendType(BackendType.DOCKER)
                .build();
        deployment.transitionTo(DeploymentStatus.DEPLOYING);
        deployment.assignBackendHandle(HANDLE);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void readiness_대기_중_종료되면_DEPLOYING_상태를_그대로_남긴다() {
        // given
        when(transitions.load(ID)).thenReturn(deployment);
        when(drivers.driverFor(BackendType.DOCKER)).thenReturn(driver);
        when(driver.create(any())).thenReturn(HANDLE);
        when(driver.getStatus(HANDLE))
                .thenReturn(new WorkloadStatus(WorkloadPhase.PROGRESSING, 1, 0, "0/1 ready", null));

        taskExecutor.submit(ID, OperationType.DEPLOY, operations::runDeploy);
        verify(driver, timeout(5000).atLeastOnce()).getStatus(HANDLE);

        // when
        taskExecutor.destroy();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> !leases.isHeld(ID));
        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.DEPLOYING);
        verify(transitions, never()).apply(any(), any(), any(), any());
        verify(transitions, never()).record(any(), any());
        verifyNoInteractions(publisher);
    }
}
