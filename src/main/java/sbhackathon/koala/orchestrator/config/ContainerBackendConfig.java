package sbhackathon.koala.orchestrator.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.util.Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Duration;

/**
 * 백엔드별 클라이언트. 클라이언트 하나를 모든 작업이 공유합니다.
 */
@Slf4j
@Configuration
public class ContainerBackendConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "docker.enabled", havingValue = "true", matchIfMissing = true)
    public DockerClient dockerClient(DockerConfig dockerConfig) {
        DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerConfig.getHost())
                .withDockerTlsVerify(false)
                .build();

        ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(dockerConfig.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(dockerConfig.getConnectionTimeoutSeconds()))
                .responseTimeout(Duration.ofSeconds(dockerConfig.getResponseTimeoutSeconds()))
                .build();

        log.info("Docker client configured for host {}", dockerConfig.getHost());
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "k8s.enabled", havingValue = "true")
    public ApiClient kubernetesApiClient(KubernetesConfig kubernetesConfig) throws IOException {
        ApiClient client = StringUtils.hasText(kubernetesConfig.getKubeconfigPath())
                ? Config.fromConfig(kubernetesConfig.getKubeconfigPath())
                : Config.defaultClient();
        client.setConnectTimeout(kubernetesConfig.getConnectTimeoutMillis());
        client.setReadTimeout(kubernetesConfig.getReadTimeoutMillis());
        log.info("Kubernetes Java Client configured (basePath={}, namespace={})",
                client.getBasePath(), kubernetesConfig.getNamespace());
        return client;
    }

    @Bean
    @ConditionalOnProperty(name = "k8s.enabled", havingValue = "true")
    public AppsV1Api appsV1Api(ApiClient kubernetesApiClient) {
        return new AppsV1Api(kubernetesApiClient);
    }

    @Bean
    @ConditionalOnProperty(name = "k8s.enabled", havingValue = "true")
    public CoreV1Api coreV1Api(ApiClient kubernetesApiClient) {
        return new CoreV1Api(kubernetesApiClient);
    }
}
