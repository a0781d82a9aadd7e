package sbhackathon.koala.orchestrator.service;

import org.junit.jupiter.api.Test;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredImageResolverTest {

    @Test
    void 레지스트리와_접두사로_이미지_참조를_만든다() {
        ConfiguredImageResolver resolver = new ConfiguredImageResolver(new OrchestratorProperties());

        assertThat(resolver.resolve("Weather")).isEqualTo("localhost:5000/mcp-server-weather:latest");
    }

    @Test
    void 레지스트리가_비어있으면_저장소_이름만_사용한다() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getImages().setRegistry("");
        properties.getImages().setTag("1.2.0");

        assertThat(new ConfiguredImageResolver(properties).resolve("github")).isEqualTo("mcp-server-github:1.2.0");
    }
}
