package sbhackathon.koala.orchestrator.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import sbhackathon.koala.orchestrator.entity.Deployment;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DeploymentRepository extends JpaRepository<Deployment, String> {

    Optional<Deployment> findByName(String name);

    List<Deployment> findByStatusNotIn(Collection<DeploymentStatus> statuses);

    @Query("SELECT d FROM Deployment d WHERE (:ownerId IS NULL OR d.ownerId = :ownerId) " +
           "AND (:status IS NULL OR d.status = :status) " +
           "AND (:environment IS NULL OR d.environment = :environment) " +
           "AND (:mcpServerId IS NULL OR d.mcpServerId = :mcpServerId) " +
           "ORDER BY d.createdAt DESC")
    List<Deployment> search(@Param("ownerId") String ownerId,
                            @Param("status") DeploymentStatus status,
                            @Param("environment") DeploymentEnvironment environment,
                            @Param("mcpServerId") String mcpServerId);
}
