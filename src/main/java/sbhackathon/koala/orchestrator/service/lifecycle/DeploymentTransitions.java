package sbhackathon.koala.orchestrator.service.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.event.DeploymentStatusPublisher;
import sbhackathon.koala.orchestrator.exception.DeploymentNotFoundException;
import sbhackathon.koala.orchestrator.exception.StaleDeploymentException;
import sbhackathon.koala.orchestrator.repository.DeploymentRepository;

import java.util.function.Consumer;

/**
 * Applies lifecycle events to the persisted record on behalf of the lease holder.
 * <p>
 * Every call reloads the row, checks the transition against {@link DeploymentStateMachine},
 * applies the mutation and persists through {@link DeploymentStatusPublisher}. A version
 * conflict can only come from a concurrent health write, so the whole step is repeated on a
 * fresh copy a few times before giving up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeploymentTransitions {

    private static final int STALE_WRITE_ATTEMPTS = 3;

    private final DeploymentRepository repository;
    private final DeploymentStateMachine stateMachine;
    private final DeploymentStatusPublisher publisher;

    public Deployment apply(String deploymentId, LifecycleEvent event, Consumer<Deployment> mutation, String message) {
        for (int attempt = 1; ; attempt++) {
            Deployment deployment = load(deploymentId);
            DeploymentStatus from = deployment.getStatus();
            DeploymentStatus to = stateMachine.next(from, event);
            deployment.transitionTo(to);
            if (mutation != null) {
                mutation.accept(deployment);
            }
            try {
                Deployment saved = publisher.publish(deployment, message);
                log.info("Deployment {} {} -> {} on {}: {}", deploymentId, from, to, event, message);
                return saved;
            } catch (StaleDeploymentException e) {
                if (attempt >= STALE_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Deployment {} changed under {} (attempt {}), reloading", deploymentId, event, attempt);
            }
        }
    }

    /**
     * Persists a mutation that does not change the lifecycle state (backend handle, replica count).
     */
    public Deployment record(String deploymentId, Consumer<Deployment> mutation) {
        for (int attempt = 1; ; attempt++) {
            Deployment deployment = load(deploymentId);
            mutation.accept(deployment);
            try {
                return publisher.persist(deployment);
            } catch (StaleDeploymentException e) {
                if (attempt >= STALE_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Deployment {} changed during update (attempt {}), reloading", deploymentId, attempt);
            }
        }
    }

    public Deployment load(String deploymentId) {
        return repository.findById(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));
    }
}
