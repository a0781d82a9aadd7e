package sbhackathon.koala.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "k8s")
public class KubernetesConfig {

    private boolean enabled = false;
    private String namespace = "mcphub";
    /**
     * 비어 있으면 in-cluster 설정 또는 ~/.kube/config 를 사용합니다.
     */
    private String kubeconfigPath;
    private int connectTimeoutMillis = 10_000;
    private int readTimeoutMillis = 30_000;
    private String cpuRequest = "100m";
    private String memoryRequest = "128Mi";
    private ImagePullSecret imagePullSecret = new ImagePullSecret();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getKubeconfigPath() {
        return kubeconfigPath;
    }

    public void setKubeconfigPath(String kubeconfigPath) {
        this.kubeconfigPath = kubeconfigPath;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public void setReadTimeoutMillis(int readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
    }

    public String getCpuRequest() {
        return cpuRequest;
    }

    public void setCpuRequest(String cpuRequest) {
        this.cpuRequest = cpuRequest;
    }

    public String getMemoryRequest() {
        return memoryRequest;
    }

    public void setMemoryRequest(String memoryRequest) {
        this.memoryRequest = memoryRequest;
    }

    public ImagePullSecret getImagePullSecret() {
        return imagePullSecret;
    }

    public void setImagePullSecret(ImagePullSecret imagePullSecret) {
        this.imagePullSecret = imagePullSecret;
    }

    public static class ImagePullSecret {
        private String name = "registry-secret";
        private boolean enabled = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
