package sbhackathon.koala.orchestrator.infra.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentCondition;
import io.kubernetes.client.openapi.models.V1DeploymentStatus;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.config.KubernetesConfig;
import sbhackathon.koala.orchestrator.entity.BackendType;
import sbhackathon.koala.orchestrator.infra.driver.ContainerDriver;
import sbhackathon.koala.orchestrator.infra.driver.DriverConflictException;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadPhase;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadSpec;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadStatus;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Cluster driver over the official Kubernetes Java client. The handle is the Deployment name;
 * the matching ClusterIP Service is named {@code <name>-service}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "k8s.enabled", havingValue = "true")
public class KubernetesWorkloadDriver implements ContainerDriver {

    private static final int REPLACE_ATTEMPTS = 3;

    private final AppsV1Api appsApi;
    private final CoreV1Api coreApi;
    private final KubernetesManifestFactory manifestFactory;
    private final KubernetesConfig kubernetesConfig;

    private volatile boolean namespaceReady;

    @FunctionalInterface
    interface KubernetesCall<T> {
        T execute() throws ApiException;
    }

    @Override
    public BackendType backendType() {
        return BackendType.KUBERNETES;
    }

    @Override
    public String create(WorkloadSpec spec) {
        spec.validate();
        ensureNamespace();
        String namespace = kubernetesConfig.getNamespace();

        try {
            call("create deployment " + spec.name(),
                    () -> appsApi.createNamespacedDeployment(namespace, manifestFactory.deployment(spec)).execute());
            log.info("Created deployment {} in namespace {}", spec.name(), namespace);
        } catch (DriverConflictException e) {
            V1Deployment existing = readDeployment(spec.name());
            requireManaged(existing, spec.name());
            log.info("Deployment {} already exists in namespace {}, adopting it", spec.name(), namespace);
        }

        String serviceName = KubernetesManifestFactory.serviceName(spec.name());
        try {
            call("create service " + serviceName,
                    () -> coreApi.createNamespacedService(namespace, manifestFactory.service(spec)).execute());
            log.info("Created service {} in namespace {}", serviceName, namespace);
        } catch (DriverConflictException e) {
            log.info("Service {} already exists in namespace {}, adopting it", serviceName, namespace);
        }
        return spec.name();
    }

    @Override
    public void start(String handle) {
        replaceDeployment(handle, deployment -> {
            int desired = desiredReplicas(deployment);
            deployment.getSpec().setReplicas(desired);
            return deployment;
        });
        log.info("Started deployment {}", handle);
    }

    @Override
    public void stop(String handle) {
        replaceDeployment(handle, deployment -> {
            deployment.getSpec().setReplicas(0);
            return deployment;
        });
        log.info("Stopped deployment {} (scaled to 0)", handle);
    }

    @Override
    public void scale(String handle, int replicas) {
        if (replicas < 1) {
            throw new InvalidSpecException("replicas must be positive: " + replicas);
        }
        replaceDeployment(handle, deployment -> {
            annotations(deployment).put(KubernetesManifestFactory.DESIRED_REPLICAS_ANNOTATION, String.valueOf(replicas));
            Integer current = deployment.getSpec().getReplicas();
            // 중지된 워크로드는 목표 값만 기록하고 0 으로 유지합니다.
            if (current != null && current > 0) {
                deployment.getSpec().setReplicas(replicas);
            }
            return deployment;
        });
        log.info("Scaled deployment {} to {} replica(s)", handle, replicas);
    }

    @Override
    public void update(String handle, WorkloadSpec spec) {
        spec.validate();
        replaceDeployment(handle, deployment -> {
            annotations(deployment).put(KubernetesManifestFactory.DESIRED_REPLICAS_ANNOTATION, String.valueOf(spec.replicas()));
            deployment.getSpec().setTemplate(manifestFactory.podTemplate(spec));
            Integer current = deployment.getSpec().getReplicas();
            if (current != null && current > 0) {
                deployment.getSpec().setReplicas(spec.replicas());
            }
            return deployment;
        });
        log.info("Rolled deployment {} to image {}", handle, spec.image());
    }

    @Override
    public void delete(String handle) {
        String namespace = kubernetesConfig.getNamespace();
        try {
            call("delete deployment " + handle, () -> appsApi.deleteNamespacedDeployment(handle, namespace).execute());
            log.info("Deleted deployment {}", handle);
        } catch (WorkloadNotFoundException e) {
            log.debug("Deployment {} already absent", handle);
        }

        String serviceName = KubernetesManifestFactory.serviceName(handle);
        try {
            call("delete service " + serviceName, () -> coreApi.deleteNamespacedService(serviceName, namespace).execute());
            log.info("Deleted service {}", serviceName);
        } catch (WorkloadNotFoundException e) {
            log.debug("Service {} already absent", serviceName);
        }
    }

    @Override
    public WorkloadStatus getStatus(String handle) {
        V1Deployment deployment;
        try {
            deployment = readDeployment(handle);
        } catch (WorkloadNotFoundException e) {
            return WorkloadStatus.missing(handle);
        }

        int specReplicas = deployment.getSpec() != null && deployment.getSpec().getReplicas() != null
                ? deployment.getSpec().getReplicas() : 0;
        V1DeploymentStatus status = deployment.getStatus();
        int ready = status != null && status.getReadyReplicas() != null ? status.getReadyReplicas() : 0;
        String endpoint = manifestFactory.endpointUrl(handle, containerPort(deployment));

        V1DeploymentCondition progressFailure = progressFailure(status);
        if (progressFailure != null) {
            return new WorkloadStatus(WorkloadPhase.FAILED, specReplicas, ready,
                    progressFailure.getReason() + ": " + progressFailure.getMessage(), endpoint);
        }
        if (specReplicas == 0) {
            return new WorkloadStatus(WorkloadPhase.STOPPED, 0, ready, "Scaled to 0", endpoint);
        }
        WorkloadPhase phase = ready >= specReplicas ? WorkloadPhase.RUNNING : WorkloadPhase.PROGRESSING;
        return new WorkloadStatus(phase, specReplicas, ready,
                String.format("%d/%d replica(s) ready", ready, specReplicas), endpoint);
    }

    @Override
    public void streamLogs(String handle, int tailLines, Consumer<String> sink) {
        String namespace = kubernetesConfig.getNamespace();
        V1PodList pods = call("list pods of " + handle, () -> coreApi.listNamespacedPod(namespace)
                .labelSelector(KubernetesManifestFactory.LABEL_APP + "=" + handle)
                .execute());
        if (pods == null || pods.getItems().isEmpty()) {
            throw new WorkloadNotFoundException(handle);
        }
        boolean prefix = pods.getItems().size() > 1;
        for (V1Pod pod : pods.getItems()) {
            String podName = pod.getMetadata().getName();
            String logs = call("read logs of pod " + podName, () -> coreApi.readNamespacedPodLog(podName, namespace)
                    .container(KubernetesManifestFactory.CONTAINER_NAME)
                    .tailLines(tailLines)
                    .execute());
            if (logs == null) {
                continue;
            }
            for (String line : logs.split("\n")) {
                sink.accept(prefix ? "[" + podName + "] " + line : line);
            }
        }
    }

    private void ensureNamespace() {
        if (namespaceReady) {
            return;
        }
        String namespace = kubernetesConfig.getNamespace();
        try {
            call("read namespace " + namespace, () -> coreApi.readNamespace(namespace).execute());
        } catch (WorkloadNotFoundException e) {
            try {
                call("create namespace " + namespace, () -> coreApi.createNamespace(
                        new V1Namespace().metadata(new V1ObjectMeta().name(namespace))).execute());
                log.info("Created namespace {}", namespace);
            } catch (DriverConflictException conflict) {
                log.debug("Namespace {} created concurrently", namespace);
            }
        }
        namespaceReady = true;
    }

    private V1Deployment readDeployment(String handle) {
        return call("read deployment " + handle,
                () -> appsApi.readNamespacedDeployment(handle, kubernetesConfig.getNamespace()).execute());
    }

    /**
     * read-modify-replace. resourceVersion 충돌 시 다시 읽어서 재시도합니다.
     */
    private void replaceDeployment(String handle, UnaryOperator<V1Deployment> mutation) {
        String namespace = kubernetesConfig.getNamespace();
        for (int attempt = 1; ; attempt++) {
            V1Deployment deployment = mutation.apply(readDeployment(handle));
            try {
                call("replace deployment " + handle,
                        () -> appsApi.replaceNamespacedDeployment(handle, namespace, deployment).execute());
                return;
            } catch (DriverConflictException e) {
                if (attempt >= REPLACE_ATTEMPTS) {
                    throw new DriverException("Deployment " + handle + " kept changing during replace", e);
                }
                log.debug("Deployment {} changed concurrently, retrying replace (attempt {})", handle, attempt);
            }
        }
    }

    private void requireManaged(V1Deployment deployment, String name) {
        Map<String, String> labels = deployment.getMetadata() != null ? deployment.getMetadata().getLabels() : null;
        if (labels == null || !KubernetesManifestFactory.MANAGED_BY.equals(labels.get(KubernetesManifestFactory.LABEL_MANAGED_BY))) {
            throw new InvalidSpecException("Deployment " + name + " exists but is not managed by "
                    + KubernetesManifestFactory.MANAGED_BY);
        }
    }

    private static Map<String, String> annotations(V1Deployment deployment) {
        if (deployment.getMetadata().getAnnotations() == null) {
            deployment.getMetadata().setAnnotations(new HashMap<>());
        }
        return deployment.getMetadata().getAnnotations();
    }

    private static int desiredReplicas(V1Deployment deployment) {
        Map<String, String> annotations = deployment.getMetadata() != null ? deployment.getMetadata().getAnnotations() : null;
        String desired = annotations != null ? annotations.get(KubernetesManifestFactory.DESIRED_REPLICAS_ANNOTATION) : null;
        if (desired != null) {
            try {
                return Math.max(1, Integer.parseInt(desired));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {} annotation '{}' on deployment {}",
                        KubernetesManifestFactory.DESIRED_REPLICAS_ANNOTATION, desired,
                        deployment.getMetadata().getName());
            }
        }
        return 1;
    }

    private static V1DeploymentCondition progressFailure(V1DeploymentStatus status) {
        if (status == null || status.getConditions() == null) {
            return null;
        }
        for (V1DeploymentCondition condition : status.getConditions()) {
            if ("Progressing".equals(condition.getType()) && "False".equals(condition.getStatus())) {
                return condition;
            }
            if ("ReplicaFailure".equals(condition.getType()) && "True".equals(condition.getStatus())) {
                return condition;
            }
        }
        return null;
    }

    private static int containerPort(V1Deployment deployment) {
        List<V1Container> containers = deployment.getSpec() != null && deployment.getSpec().getTemplate().getSpec() != null
                ? deployment.getSpec().getTemplate().getSpec().getContainers() : List.of();
        for (V1Container container : containers) {
            if (container.getPorts() != null && !container.getPorts().isEmpty()) {
                return container.getPorts().get(0).getContainerPort();
            }
        }
        return 80;
    }

    private <T> T call(String action, KubernetesCall<T> call) {
        try {
            return call.execute();
        } catch (ApiException e) {
            throw KubernetesErrors.translate(action, e);
        }
    }
}
