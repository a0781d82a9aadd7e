package sbhackathon.koala.orchestrator.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import sbhackathon.koala.orchestrator.config.OrchestratorProperties;
import sbhackathon.koala.orchestrator.event.DeploymentEvent;
import sbhackathon.koala.orchestrator.event.DeploymentEventStream;

import java.io.IOException;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * 배포 상태 변경 이벤트를 Server-Sent Events 로 전달합니다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/deployments")
public class DeploymentEventController {

    private final DeploymentEventStream eventStream;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@RequestParam(value = "deploymentId", required = false) String deploymentId) {
        SseEmitter emitter = new SseEmitter(properties.getEvents().getSseTimeoutMillis());
        String subscriberId = "sse-" + UUID.randomUUID();
        Predicate<DeploymentEvent> filter = deploymentId == null
                ? event -> true
                : event -> deploymentId.equals(event.deploymentId());

        eventStream.subscribe(subscriberId, filter, (DeploymentEvent event) -> {
            try {
                String json = objectMapper.writeValueAsString(event);
                emitter.send(SseEmitter.event().name("deployment-status").data(json));
            } catch (IOException e) {
                emitter.completeWithError(e);
            }
        });

        Runnable cleanup = () -> eventStream.unsubscribe(subscriberId);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError((e) -> cleanup.run());

        log.debug("SSE subscriber {} connected (deployment filter: {})", subscriberId, deploymentId);
        return emitter;
    }
}
