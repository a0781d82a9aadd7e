package sbhackathon.koala.orchestrator.service.task;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 배포 id 별 lease 테이블. 프로세스 메모리에만 존재하며 재시작 시 비어 있는 상태로 시작합니다.
 * <p>
 * 작업이 처리하지 못한 채 lease 를 반납한 stop/delete 요청은 id 별로 보관되며,
 * 헬스 모니터가 {@link #takeUnhandledIntent(String)} 로 꺼내 이어서 실행합니다.
 */
@Slf4j
@Component
public class DeploymentLeaseRegistry {

    private final Map<String, DeploymentLease> leases = new ConcurrentHashMap<>();
    private final Map<String, PendingIntent> unhandled = new ConcurrentHashMap<>();
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong releases = new AtomicLong();

    public Optional<DeploymentLease> tryAcquire(String deploymentId, OperationType operation) {
        DeploymentLease candidate = new DeploymentLease(deploymentId, operation);
        DeploymentLease existing = leases.putIfAbsent(deploymentId, candidate);
        if (existing != null) {
            rejections.incrementAndGet();
            log.debug("Lease for deployment {} denied to {}: held by {}", deploymentId, operation, existing.getOperation());
            return Optional.empty();
        }
        acquisitions.incrementAndGet();
        if (operation != OperationType.RECONCILE) {
            // 새 작업이 시작되면 이전 요청은 대체됩니다
            unhandled.remove(deploymentId);
        }
        log.debug("Lease for deployment {} acquired by {}", deploymentId, operation);
        return Optional.of(candidate);
    }

    public void release(DeploymentLease lease) {
        if (leases.remove(lease.getDeploymentId(), lease)) {
            releases.incrementAndGet();
            if (!lease.isAbandoned()) {
                lease.pendingIntent().ifPresent(intent -> deferIntent(lease.getDeploymentId(), intent));
            }
            log.debug("Lease for deployment {} released by {}", lease.getDeploymentId(), lease.getOperation());
        }
    }

    public boolean isHeld(String deploymentId) {
        return leases.containsKey(deploymentId);
    }

    public Optional<DeploymentLease> current(String deploymentId) {
        return Optional.ofNullable(leases.get(deploymentId));
    }

    /**
     * 진행 중인 작업에 stop/delete 의도를 전달합니다.
     *
     * @return 작업이 의도를 받아들였으면 true, lease 가 없거나 취소할 수 없는 작업이면 false
     */
    public boolean requestCancellation(String deploymentId, PendingIntent intent) {
        DeploymentLease lease = leases.get(deploymentId);
        if (lease == null) {
            return false;
        }
        boolean accepted = lease.requestCancellation(intent);
        if (accepted) {
            log.info("{} requested for deployment {} while {} is in flight", intent, deploymentId, lease.getOperation());
        }
        return accepted;
    }

    /**
     * 실행되지 못한 stop/delete 요청을 보관합니다. 이미 보관된 요청이 있으면 더 강한 쪽(DELETE)이 남습니다.
     */
    public void deferIntent(String deploymentId, PendingIntent intent) {
        PendingIntent merged = unhandled.merge(deploymentId, intent, PendingIntent::merge);
        log.info("{} request for deployment {} left for the health monitor", merged, deploymentId);
    }

    public Optional<PendingIntent> takeUnhandledIntent(String deploymentId) {
        return Optional.ofNullable(unhandled.remove(deploymentId));
    }

    /**
     * 종료 시 호출: 진행 중인 모든 작업이 다음 checkpoint 에서 기록 없이 멈추도록 표시합니다.
     */
    public void abandonAll() {
        leases.values().forEach(DeploymentLease::abandon);
    }

    public int activeCount() {
        return leases.size();
    }

    public long getAcquisitionCount() {
        return acquisitions.get();
    }

    public long getRejectionCount() {
        return rejections.get();
    }

    public long getReleaseCount() {
        return releases.get();
    }
}
