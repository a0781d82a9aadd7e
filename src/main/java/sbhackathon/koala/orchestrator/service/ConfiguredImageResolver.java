package sbhackathon.koala.orchestrator.service;

import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;

import java.util.Locale;

/**
 * {@code orchestrator.images.*} 설정으로 {@code <registry>/<prefix><mcpServerId>:<tag>} 형식의 이미지 참조를 만듭니다.
 */
@Component
public class ConfiguredImageResolver implements McpServerImageResolver {

    private final OrchestratorProperties.Images images;

    public ConfiguredImageResolver(OrchestratorProperties properties) {
        this.images = properties.getImages();
    }

    @Override
    public String resolve(String mcpServerId) {
        String repository = (images.getRepositoryPrefix() + mcpServerId).toLowerCase(Locale.ROOT);
        String registry = images.getRegistry();
        if (registry == null || registry.isBlank()) {
            return repository + ":" + images.getTag();
        }
        return registry + "/" + repository + ":" + images.getTag();
    }
}
