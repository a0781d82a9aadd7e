package sbhackathon.koala.orchestrator.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import sbhackathon.koala.orchestrator.dto.CreateDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.DeploymentFilter;
import sbhackathon.koala.orchestrator.dto.DeploymentLogsResponse;
import sbhackathon.koala.orchestrator.dto.DeploymentResponse;
import sbhackathon.koala.orchestrator.dto.ScaleDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.UpdateDeploymentRequest;
import sbhackathon.koala.orchestrator.entity.DeploymentEnvironment;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;
import sbhackathon.koala.orchestrator.service.DeploymentService;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/deployments")
public class DeploymentController {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentController.class);
    static final String OWNER_HEADER = "X-Owner-Id";

    private final DeploymentService deploymentService;

    public DeploymentController(DeploymentService deploymentService) {
        this.deploymentService = deploymentService;
    }

    /**
     * 새 MCP 서버 배포를 요청합니다. 배포는 비동기로 진행되며 PENDING 상태의 배포를 즉시 반환합니다.
     *
     * @param request 배포 요청 (mcpServerId, 이름, 환경, replica 수 등)
     * @param ownerId 요청자 id
     * @return 202 와 저장된 배포
     */
    @PostMapping
    public ResponseEntity<DeploymentResponse> create(@RequestBody CreateDeploymentRequest request,
                                                     @RequestHeader(value = OWNER_HEADER, required = false) String ownerId) {
        logger.info("배포 요청 수신 - 이름: {}, MCP 서버: {}, 환경: {}",
                request != null ? request.getName() : null,
                request != null ? request.getMcpServerId() : null,
                request != null ? request.getEnvironment() : null);
        return accepted(DeploymentResponse.from(deploymentService.createDeployment(request, ownerId)));
    }

    @GetMapping
    public ResponseEntity<List<DeploymentResponse>> list(@RequestParam(value = "ownerId", required = false) String ownerId,
                                                         @RequestParam(value = "status", required = false) String status,
                                                         @RequestParam(value = "environment", required = false) String environment,
                                                         @RequestParam(value = "mcpServerId", required = false) String mcpServerId) {
        DeploymentFilter filter = DeploymentFilter.builder()
                .ownerId(ownerId)
                .status(parseStatus(status))
                .environment(parseEnvironment(environment))
                .mcpServerId(mcpServerId)
                .build();
        List<DeploymentResponse> deployments = deploymentService.listDeployments(filter).stream()
                .map(DeploymentResponse::from)
                .toList();
        return ResponseEntity.ok(deployments);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DeploymentResponse> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(DeploymentResponse.from(deploymentService.getDeployment(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<DeploymentResponse> start(@PathVariable("id") String id) {
        logger.info("배포 시작 요청 - id: {}", id);
        return accepted(DeploymentResponse.from(deploymentService.startDeployment(id)));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<DeploymentResponse> stop(@PathVariable("id") String id) {
        logger.info("배포 중지 요청 - id: {}", id);
        return accepted(DeploymentResponse.from(deploymentService.stopDeployment(id)));
    }

    @PostMapping("/{id}/scale")
    public ResponseEntity<DeploymentResponse> scale(@PathVariable("id") String id,
                                                    @RequestBody ScaleDeploymentRequest request) {
        if (request == null) {
            throw new DeploymentValidationException("요청 본문이 비어있습니다.");
        }
        logger.info("스케일 요청 수신 - id: {}, replicas: {}", id, request.getReplicas());
        return accepted(DeploymentResponse.from(deploymentService.scaleDeployment(id, request.getReplicas())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DeploymentResponse> update(@PathVariable("id") String id,
                                                     @RequestBody UpdateDeploymentRequest request) {
        logger.info("배포 설정 변경 요청 - id: {}", id);
        return accepted(DeploymentResponse.from(deploymentService.updateDeployment(id, request)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<DeploymentResponse> retry(@PathVariable("id") String id) {
        logger.info("배포 재시도 요청 - id: {}", id);
        return accepted(DeploymentResponse.from(deploymentService.retryDeployment(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<DeploymentResponse> delete(@PathVariable("id") String id) {
        logger.info("배포 삭제 요청 - id: {}", id);
        return accepted(DeploymentResponse.from(deploymentService.deleteDeployment(id)));
    }

    @GetMapping("/{id}/logs")
    public ResponseEntity<DeploymentLogsResponse> logs(@PathVariable("id") String id,
                                                       @RequestParam(value = "tail", required = false) Integer tail) {
        List<String> lines = deploymentService.getDeploymentLogs(id, tail);
        return ResponseEntity.ok(DeploymentLogsResponse.builder()
                .deploymentId(id)
                .tail(tail != null ? tail : lines.size())
                .lines(lines)
                .build());
    }

    private static ResponseEntity<DeploymentResponse> accepted(DeploymentResponse body) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    private static DeploymentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return DeploymentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DeploymentValidationException("알 수 없는 상태입니다: " + status, e);
        }
    }

    private static DeploymentEnvironment parseEnvironment(String environment) {
        if (environment == null || environment.isBlank()) {
            return null;
        }
        try {
            return DeploymentEnvironment.fromValue(environment);
        } catch (IllegalArgumentException e) {
            throw new DeploymentValidationException("알 수 없는 환경입니다: " + environment, e);
        }
    }
}
