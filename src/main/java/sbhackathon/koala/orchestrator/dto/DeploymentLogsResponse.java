package sbhackathon.koala.orchestrator.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class DeploymentLogsResponse {
    private final String deploymentId;
    private final int tail;
    private final List<String> lines;
}
