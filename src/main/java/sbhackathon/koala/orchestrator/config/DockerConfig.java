package sbhackathon.koala.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "docker")
public class DockerConfig {

    private boolean enabled = true;
    private String host = "unix:///var/run/docker.sock";
    /**
     * 컨테이너를 붙일 네트워크. 비어 있으면 Docker 기본 bridge 를 사용합니다.
     */
    private String network;
    private int maxConnections = 100;
    private int connectionTimeoutSeconds = 30;
    private int responseTimeoutSeconds = 45;
    private int stopTimeoutSeconds = 10;
    private int pullTimeoutSeconds = 300;
    private int logTimeoutSeconds = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getConnectionTimeoutSeconds() {
        return connectionTimeoutSeconds;
    }

    public void setConnectionTimeoutSeconds(int connectionTimeoutSeconds) {
        this.connectionTimeoutSeconds = connectionTimeoutSeconds;
    }

    public int getResponseTimeoutSeconds() {
        return responseTimeoutSeconds;
    }

    public void setResponseTimeoutSeconds(int responseTimeoutSeconds) {
        this.responseTimeoutSeconds = responseTimeoutSeconds;
    }

    public int getStopTimeoutSeconds() {
        return stopTimeoutSeconds;
    }

    public void setStopTimeoutSeconds(int stopTimeoutSeconds) {
        this.stopTimeoutSeconds = stopTimeoutSeconds;
    }

    public int getPullTimeoutSeconds() {
        return pullTimeoutSeconds;
    }

    public void setPullTimeoutSeconds(int pullTimeoutSeconds) {
        this.pullTimeoutSeconds = pullTimeoutSeconds;
    }

    public int getLogTimeoutSeconds() {
        return logTimeoutSeconds;
    }

    public void setLogTimeoutSeconds(int logTimeoutSeconds) {
        this.logTimeoutSeconds = logTimeoutSeconds;
    }
}
