package sbhackathon.koala.orchestrator.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.entity.HealthStatus;
import sbhackathon.koala.orchestrator.exception.StaleDeploymentException;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeploymentStatusPublisherTest {

    @Mock
    private DeploymentRepository repository;

    @Mock
    private DeploymentEventStream eventStream;

    private DeploymentStatusPublisher publisher;
    private Deployment deployment;

    @BeforeEach
    void setUp() {
        publisher = new DeploymentStatusPublisher(repository, eventStream);
        deployment = Deployment.builder()
                .id("d-1")
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
    }

    @Test
    void 저장_후에_이벤트를_발행한다() {
        when(repository.saveAndFlush(deployment)).thenReturn(deployment);

        Deployment saved = publisher.publish(deployment, "Deployment accepted");

        assertThat(saved).isSameAs(deployment);
        InOrder order = inOrder(repository, eventStream);
        order.verify(repository).saveAndFlush(deployment);
        ArgumentCaptor<DeploymentEvent> captor = ArgumentCaptor.forClass(DeploymentEvent.class);
        order.verify(eventStream).publish(captor.capture());
        assertThat(captor.getValue().deploymentId()).isEqualTo("d-1");
        assertThat(captor.getValue().status()).isEqualTo(DeploymentStatus.PENDING);
        assertThat(captor.getValue().message()).isEqualTo("Deployment accepted");
    }

    @Test
    void 버전_충돌이면_이벤트를_발행하지_않는다() {
        when(repository.saveAndFlush(deployment))
                .thenThrow(new ObjectOptimisticLockingFailureException(Deployment.class, "d-1"));

        assertThatThrownBy(() -> publisher.publish(deployment, "health changed"))
                .isInstanceOf(StaleDeploymentException.class);
        verify(eventStream, never()).publish(any());
    }

    @Test
    void 삭제_이벤트는_STOPPED와_UNKNOWN으로_발행한다() {
        publisher.publishRemoval(deployment);

        verify(repository).delete(deployment);
        ArgumentCaptor<DeploymentEvent> captor = ArgumentCaptor.forClass(DeploymentEvent.class);
        verify(eventStream).publish(captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(DeploymentStatus.STOPPED);
        assertThat(captor.getValue().health()).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(captor.getValue().message()).isEqualTo(DeploymentStatusPublisher.REMOVED_MESSAGE);
    }

    @Test
    void 삭제_중_버전_충돌이면_이벤트를_발행하지_않는다() {
        doThrow(new ObjectOptimisticLockingFailureException(Deployment.class, "d-1"))
                .when(repository).delete(deployment);

        assertThatThrownBy(() -> publisher.publishRemoval(deployment))
                .isInstanceOf(StaleDeploymentException.class);
        verify(eventStream, never()).publish(any());
    }
}
