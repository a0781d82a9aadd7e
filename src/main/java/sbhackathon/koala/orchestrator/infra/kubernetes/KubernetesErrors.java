package sbhackathon.koala.orchestrator.infra.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import sbhackathon.koala.orchestrator.infra.driver.DriverConflictException;
import sbhackathon.koala.orchestrator.infra.driver.DriverConnectivityException;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.DriverTimeoutException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceExhaustionException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;

import java.io.InterruptedIOException;
import java.util.Locale;

/**
 * Maps API server responses onto the driver error taxonomy.
 */
final class KubernetesErrors {

    private KubernetesErrors() {
    }

    static DriverException translate(String action, ApiException e) {
        int code = e.getCode();
        String detail = detail(e);
        if (code == 0) {
            // 응답 없이 실패: 연결 불가 또는 타임아웃
            if (isTimeout(e)) {
                return new DriverTimeoutException("Timed out trying to " + action, e);
            }
            return new DriverConnectivityException("Kubernetes API unreachable while trying to " + action + ": " + detail, e);
        }
        switch (code) {
            case 404:
                return new WorkloadNotFoundException(action, e);
            case 409:
                return new DriverConflictException("Conflict while trying to " + action + ": " + detail, e);
            case 400:
            case 422:
                return new InvalidSpecException("Rejected by the API server while trying to " + action + ": " + detail, e);
            case 403:
                if (detail.toLowerCase(Locale.ROOT).contains("exceeded quota")) {
                    return new ResourceExhaustionException("Quota exceeded while trying to " + action + ": " + detail, e);
                }
                return new DriverException("Forbidden to " + action + ": " + detail, e);
            case 504:
                return new DriverTimeoutException("API server timed out while trying to " + action, e);
            case 429:
            case 500:
            case 502:
            case 503:
                return new DriverConnectivityException("API server unavailable (" + code + ") while trying to " + action, e);
            default:
                return new DriverException("Failed to " + action + " (" + code + "): " + detail, e);
        }
    }

    private static boolean isTimeout(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof InterruptedIOException) {
                return true;
            }
        }
        return false;
    }

    private static String detail(ApiException e) {
        String body = e.getResponseBody();
        if (body != null && !body.isBlank()) {
            return body;
        }
        return e.getMessage() != null ? e.getMessage() : "no detail";
    }
}
