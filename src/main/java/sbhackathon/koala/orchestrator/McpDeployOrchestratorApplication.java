package sbhackathon.koala.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class McpDeployOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpDeployOrchestratorApplication.class, args);
    }
}
