package sbhackathon.koala.orchestrator.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import sbhackathon.koala.orchestrator.dto.ErrorResponse;
import sbhackathon.koala.orchestrator.exception.DeploymentBusyException;
import sbhackathon.koala.orchestrator.exception.DeploymentNotFoundException;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;
import sbhackathon.koala.orchestrator.exception.IllegalStateTransitionException;
import sbhackathon.koala.orchestrator.exception.StaleDeploymentException;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DeploymentValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(DeploymentValidationException e) {
        log.warn("배포 요청 검증 실패: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("요청 본문을 읽을 수 없습니다: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "요청 본문이 올바르지 않습니다.");
    }

    @ExceptionHandler(DeploymentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DeploymentNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler({DeploymentBusyException.class, IllegalStateTransitionException.class, StaleDeploymentException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.info("요청 충돌: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CONFLICT", e.getMessage());
    }

    @ExceptionHandler(DriverException.class)
    public ResponseEntity<ErrorResponse> handleDriver(DriverException e) {
        log.error("백엔드 호출 실패: {}", e.getMessage(), e);
        return respond(HttpStatus.BAD_GATEWAY, "BACKEND_ERROR", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
