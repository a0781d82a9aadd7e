package sbhackathon.koala.orchestrator.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.entity.HealthStatus;
import sbhackathon.koala.orchestrator.exception.StaleDeploymentException;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;

import java.time.Instant;

/**
 * Persist-then-emit. An event is emitted only after the write (with its version check)
 * has been flushed; a stale write raises {@link StaleDeploymentException} and emits nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeploymentStatusPublisher {

    static final String REMOVED_MESSAGE = "Deployment removed";

    private final DeploymentRepository repository;
    private final DeploymentEventStream eventStream;

    public Deployment publish(Deployment deployment, String message) {
        Deployment saved = persist(deployment);
        eventStream.publish(DeploymentEvent.of(saved, message));
        return saved;
    }

    public Deployment persist(Deployment deployment) {
        try {
            return repository.saveAndFlush(deployment);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StaleDeploymentException(deployment.getId(), e);
        }
    }

    /**
     * Deletes the row and emits a final event. Subscribers see status STOPPED with unknown
     * health; the record no longer exists afterwards.
     */
    public void publishRemoval(Deployment deployment) {
        try {
            repository.delete(deployment);
            repository.flush();
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StaleDeploymentException(deployment.getId(), e);
        }
        log.info("Deployment {} ({}) removed", deployment.getId(), deployment.getName());
        eventStream.publish(new DeploymentEvent(deployment.getId(), DeploymentStatus.STOPPED,
                HealthStatus.UNKNOWN, REMOVED_MESSAGE, Instant.now()));
    }
}
