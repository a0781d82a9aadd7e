package sbhackathon.koala.orchestrator.support;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Replaces the Docker backend in Spring tests ({@code docker.enabled=false} in the test profile).
 */
@Configuration
public class FakeDriverConfiguration {

    @Bean
    public FakeContainerDriver fakeContainerDriver() {
        return new FakeContainerDriver();
    }
}
