package sbhackathon.koala.orchestrator.infra.kubernetes;

import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1HTTPGetAction;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1LocalObjectReference;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1Probe;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.KubernetesConfig;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * MCP 서버 워크로드의 Deployment / Service 매니페스트를 생성합니다.
 * <p>
 * Deployment 는 replicas 0 으로 생성되고, 원하는 replica 수는
 * {@value #DESIRED_REPLICAS_ANNOTATION} 어노테이션에 보관됩니다. start 시 이 값으로 스케일됩니다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "k8s.enabled", havingValue = "true")
public class KubernetesManifestFactory {

    public static final String DESIRED_REPLICAS_ANNOTATION = "mcphub.io/desired-replicas";
    static final String CONTAINER_NAME = "mcp-server";
    static final String LABEL_APP = "app";
    static final String LABEL_MANAGED_BY = "managed-by";
    static final String LABEL_MCP_SERVER_ID = "mcp-server-id";
    static final String LABEL_DEPLOYMENT_ID = "deployment-id";
    static final String MANAGED_BY = "mcp-hub";

    private final KubernetesConfig kubernetesConfig;

    public V1Deployment deployment(WorkloadSpec spec) {
        Map<String, String> labels = labels(spec);
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(DESIRED_REPLICAS_ANNOTATION, String.valueOf(spec.replicas()));

        return new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(new V1ObjectMeta()
                        .name(spec.name())
                        .namespace(kubernetesConfig.getNamespace())
                        .labels(labels)
                        .annotations(annotations))
                .spec(new V1DeploymentSpec()
                        .replicas(0)
                        .selector(new V1LabelSelector().matchLabels(Map.of(LABEL_APP, spec.name())))
                        .template(podTemplate(spec)));
    }

    public V1PodTemplateSpec podTemplate(WorkloadSpec spec) {
        V1PodSpec podSpec = new V1PodSpec().containers(List.of(container(spec)));
        if (kubernetesConfig.getImagePullSecret().isEnabled()) {
            podSpec.imagePullSecrets(List.of(
                    new V1LocalObjectReference().name(kubernetesConfig.getImagePullSecret().getName())));
        }
        return new V1PodTemplateSpec()
                .metadata(new V1ObjectMeta().labels(labels(spec)))
                .spec(podSpec);
    }

    public V1Service service(WorkloadSpec spec) {
        return new V1Service()
                .apiVersion("v1")
                .kind("Service")
                .metadata(new V1ObjectMeta()
                        .name(serviceName(spec.name()))
                        .namespace(kubernetesConfig.getNamespace())
                        .labels(labels(spec)))
                .spec(new V1ServiceSpec()
                        .type("ClusterIP")
                        .selector(Map.of(LABEL_APP, spec.name()))
                        .ports(List.of(new V1ServicePort()
                                .name("http")
                                .protocol("TCP")
                                .port(spec.containerPort())
                                .targetPort(new IntOrString(spec.containerPort())))));
    }

    public static String serviceName(String workloadName) {
        return workloadName + "-service";
    }

    public String endpointUrl(String workloadName, int port) {
        return "http://" + serviceName(workloadName) + "." + kubernetesConfig.getNamespace()
                + ".svc.cluster.local:" + port;
    }

    private V1Container container(WorkloadSpec spec) {
        List<V1EnvVar> env = new TreeMap<>(spec.environment()).entrySet().stream()
                .map(e -> new V1EnvVar().name(e.getKey()).value(e.getValue()))
                .toList();

        return new V1Container()
                .name(CONTAINER_NAME)
                .image(spec.image())
                .ports(List.of(new V1ContainerPort().name("http").containerPort(spec.containerPort())))
                .env(env)
                .resources(new V1ResourceRequirements()
                        .limits(Map.of(
                                "cpu", Quantity.fromString(spec.cpuLimit()),
                                "memory", Quantity.fromString(spec.memoryLimit())))
                        .requests(Map.of(
                                "cpu", Quantity.fromString(kubernetesConfig.getCpuRequest()),
                                "memory", Quantity.fromString(kubernetesConfig.getMemoryRequest()))))
                .livenessProbe(httpProbe(spec, 30, 10))
                .readinessProbe(httpProbe(spec, 5, 5));
    }

    private V1Probe httpProbe(WorkloadSpec spec, int initialDelaySeconds, int periodSeconds) {
        return new V1Probe()
                .httpGet(new V1HTTPGetAction()
                        .path(spec.healthCheckPath())
                        .port(new IntOrString(spec.containerPort())))
                .initialDelaySeconds(initialDelaySeconds)
                .periodSeconds(periodSeconds);
    }

    private Map<String, String> labels(WorkloadSpec spec) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_APP, spec.name());
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);
        if (spec.mcpServerId() != null) {
            labels.put(LABEL_MCP_SERVER_ID, spec.mcpServerId());
        }
        if (spec.deploymentId() != null) {
            labels.put(LABEL_DEPLOYMENT_ID, spec.deploymentId());
        }
        return labels;
    }
}
