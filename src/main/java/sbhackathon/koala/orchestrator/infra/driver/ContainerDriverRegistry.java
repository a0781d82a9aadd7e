package sbhackathon.koala.orchestrator.infra.driver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the driver for an environment. Routing is read once from
 * {@code orchestrator.backends.*} when the registry is built; an environment routed to a
 * backend without a driver bean fails startup.
 */
@Slf4j
@Component
public class ContainerDriverRegistry {

    private final Map<BackendType, ContainerDriver> drivers = new EnumMap<>(BackendType.class);
    private final Map<DeploymentEnvironment, BackendType> routing = new EnumMap<>(DeploymentEnvironment.class);

    public ContainerDriverRegistry(List<ContainerDriver> driverBeans, OrchestratorProperties properties) {
        for (ContainerDriver driver : driverBeans) {
            ContainerDriver previous = drivers.put(driver.backendType(), driver);
            if (previous != null) {
                throw new IllegalStateException("Two drivers registered for backend " + driver.backendType()
                        + ": " + previous.getClass().getSimpleName() + ", " + driver.getClass().getSimpleName());
            }
        }

        for (DeploymentEnvironment environment : DeploymentEnvironment.values()) {
            String configured = properties.getBackends().get(environment.name().toLowerCase(Locale.ROOT));
            if (configured == null) {
                throw new IllegalStateException("No backend configured for environment " + environment
                        + " (orchestrator.backends." + environment.name().toLowerCase(Locale.ROOT) + ")");
            }
            BackendType backend = BackendType.fromValue(configured);
            if (!drivers.containsKey(backend)) {
                throw new IllegalStateException("Environment " + environment + " is routed to backend "
                        + backend + " but that backend is disabled");
            }
            routing.put(environment, backend);
        }
        log.info("Container backends: drivers={}, routing={}", drivers.keySet(), routing);
    }

    public BackendType backendFor(DeploymentEnvironment environment) {
        return routing.get(environment);
    }

    public ContainerDriver driverFor(BackendType backendType) {
        ContainerDriver driver = drivers.get(backendType);
        if (driver == null) {
            throw new DriverException("No driver available for backend " + backendType);
        }
        return driver;
    }

    public Map<DeploymentEnvironment, BackendType> routing() {
        return Collections.unmodifiableMap(routing);
    }
}
