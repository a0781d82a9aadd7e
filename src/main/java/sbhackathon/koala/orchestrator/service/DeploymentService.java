package sbhackathon.koala.orchestrator.service;

import sbhackathon.koala.orchestrator.dto.CreateDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.DeploymentFilter;
import sbhackathon.koala.orchestrator.dto.UpdateDeploymentRequest;
import sbhackathon.koala.orchestrator.entity.Deployment;

import java.util.List;

/**
 * 배포 수명주기 요청의 진입점. 변경 요청은 중간 상태를 저장한 뒤 즉시 반환하고,
 * 실제 인프라 작업은 작업 풀에서 비동기로 진행됩니다.
 */
public interface DeploymentService {

    /**
     * 새 배포를 PENDING 상태로 저장하고 배포 작업을 제출합니다. 같은 이름의 배포가 이미 있으면 그 배포를 반환합니다.
     *
     * @param request 배포 요청
     * @param ownerId 요청자 id (없으면 null)
     * @return 저장된 배포
     */
    Deployment createDeployment(CreateDeploymentRequest request, String ownerId);

    Deployment startDeployment(String deploymentId);

    /**
     * 배포를 중지합니다. 배포/스케일/업데이트가 진행 중이면 해당 작업을 취소하고 정리합니다.
     */
    Deployment stopDeployment(String deploymentId);

    Deployment scaleDeployment(String deploymentId, Integer replicas);

    Deployment updateDeployment(String deploymentId, UpdateDeploymentRequest request);

    /**
     * 인프라를 제거한 뒤 레코드를 삭제합니다. 진행 중인 작업이 있으면 취소하고 정리합니다.
     */
    Deployment deleteDeployment(String deploymentId);

    /**
     * FAILED 배포를 다시 배포합니다.
     */
    Deployment retryDeployment(String deploymentId);

    Deployment getDeployment(String deploymentId);

    List<Deployment> listDeployments(DeploymentFilter filter);

    List<String> getDeploymentLogs(String deploymentId, Integer tailLines);
}
