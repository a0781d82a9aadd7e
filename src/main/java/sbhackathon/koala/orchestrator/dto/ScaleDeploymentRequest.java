package sbhackathon.koala.orchestrator.dto;

public class ScaleDeploymentRequest {
    private Integer replicas;

    public ScaleDeploymentRequest() {
    }

    public ScaleDeploymentRequest(Integer replicas) {
        this.replicas = replicas;
    }

    public Integer getReplicas() {
        return replicas;
    }

    public void setReplicas(Integer replicas) {
        this.replicas = replicas;
    }
}
