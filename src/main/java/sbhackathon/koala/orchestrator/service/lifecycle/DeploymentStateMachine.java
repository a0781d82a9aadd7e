package sbhackathon.koala.orchestrator.service.lifecycle;

import org.springframework.stereotype.Component;
import sbhackathon.koala.orchestrator.entity.DeploymentStatus;
import sbhackathon.koala.orchestrator.exception.IllegalStateTransitionException;

import java.util.EnumMap;
import java.util.Map;

import static sbhackathon.koala.orchestrator.entity.DeploymentStatus.*;

/**
 * 배포 상태 전이표. 표에 없는 (상태, 이벤트) 조합은 {@link IllegalStateTransitionException} 으로 거부됩니다.
 */
@Component
public class DeploymentStateMachine {

    private final Map<DeploymentStatus, Map<LifecycleEvent, DeploymentStatus>> table = new EnumMap<>(DeploymentStatus.class);

    public DeploymentStateMachine() {
        allow(PENDING, LifecycleEvent.SUBMIT, DEPLOYING);

        allow(DEPLOYING, LifecycleEvent.SUCCEED, RUNNING);
        allow(DEPLOYING, LifecycleEvent.FAIL, FAILED);

        allow(RUNNING, LifecycleEvent.SCALE, SCALING);
        allow(SCALING, LifecycleEvent.SUCCEED, RUNNING);
        allow(SCALING, LifecycleEvent.FAIL, ERROR);

        allow(RUNNING, LifecycleEvent.UPDATE, UPDATING);
        allow(UPDATING, LifecycleEvent.SUCCEED, RUNNING);
        allow(UPDATING, LifecycleEvent.FAIL, ERROR);

        allow(RUNNING, LifecycleEvent.STOP, STOPPING);
        allow(ERROR, LifecycleEvent.STOP, STOPPING);
        allow(STOPPING, LifecycleEvent.SUCCEED, STOPPED);
        allow(STOPPING, LifecycleEvent.FAIL, ERROR);

        allow(STOPPED, LifecycleEvent.START, DEPLOYING);
        allow(FAILED, LifecycleEvent.RESUBMIT, PENDING);

        allow(RUNNING, LifecycleEvent.RECOVERY_EXHAUSTED, ERROR);

        // 진행 중인 작업에 대한 stop 요청
        allow(DEPLOYING, LifecycleEvent.CANCEL, STOPPING);
        allow(SCALING, LifecycleEvent.CANCEL, STOPPING);
        allow(UPDATING, LifecycleEvent.CANCEL, STOPPING);

        for (DeploymentStatus status : DeploymentStatus.values()) {
            allow(status, LifecycleEvent.DELETE, STOPPING);
        }
    }

    public DeploymentStatus next(DeploymentStatus from, LifecycleEvent event) {
        DeploymentStatus to = table.getOrDefault(from, Map.of()).get(event);
        if (to == null) {
            throw new IllegalStateTransitionException(from, event.name());
        }
        return to;
    }

    public boolean canApply(DeploymentStatus from, LifecycleEvent event) {
        return table.getOrDefault(from, Map.of()).containsKey(event);
    }

    private void allow(DeploymentStatus from, LifecycleEvent event, DeploymentStatus to) {
        table.computeIfAbsent(from, key -> new EnumMap<>(LifecycleEvent.class)).put(event, to);
    }
}
