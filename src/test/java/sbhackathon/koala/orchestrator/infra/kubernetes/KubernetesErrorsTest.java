package sbhackathon.koala.orchestrator.infra.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import org.junit.jupiter.api.Test;
import sbhackathon.koala.orchestrator.infra.driver.DriverConflictException;
import sbhackathon.koala.orchestrator.infra.driver.DriverConnectivityException;
import sbhackathon.koala.orchestrator.infra.driver.DriverException;
import sbhackathon.koala.orchestrator.infra.driver.DriverTimeoutException;
import sbhackathon.koala.orchestrator.infra.driver.InvalidSpecException;
import sbhackathon.koala.orchestrator.infra.driver.ResourceExhaustionException;
import sbhackathon.koala.orchestrator.infra.driver.WorkloadNotFoundException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KubernetesErrorsTest {

    @Test
    void 응답이_없으면_연결_오류_또는_타임아웃() {
        DriverException refused = KubernetesErrors.translate("create deployment", new ApiException(new ConnectException("Connection refused")));
        DriverException timeout = KubernetesErrors.translate("create deployment", new ApiException(new SocketTimeoutException("read timed out")));

        assertThat(refused).isInstanceOf(DriverConnectivityException.class);
        assertThat(refused.isRetryable()).isTrue();
        assertThat(timeout).isInstanceOf(DriverTimeoutException.class);
        assertThat(timeout.isRetryable()).isTrue();
    }

    @Test
    void 상태_코드별_분류() {
        assertThat(translate(404, "not found")).isInstanceOf(WorkloadNotFoundException.class);
        assertThat(translate(409, "already exists")).isInstanceOf(DriverConflictException.class);
        assertThat(translate(422, "spec.replicas: Invalid value")).isInstanceOf(InvalidSpecException.class);
        assertThat(translate(400, "bad request")).isInstanceOf(InvalidSpecException.class);
        assertThat(translate(503, "unavailable")).isInstanceOf(DriverConnectivityException.class);
        assertThat(translate(429, "too many requests")).isInstanceOf(DriverConnectivityException.class);
        assertThat(translate(504, "gateway timeout")).isInstanceOf(DriverTimeoutException.class);
    }

    @Test
    void 쿼터_초과는_재시도하지_않는_자원_부족() {
        DriverException quota = translate(403, "pods \"mcp-weather\" is forbidden: exceeded quota: compute-resources");
        DriverException forbidden = translate(403, "forbidden: User cannot create deployments");

        assertThat(quota).isInstanceOf(ResourceExhaustionException.class);
        assertThat(quota.isRetryable()).isFalse();
        assertThat(quota.getMessage()).contains("exceeded quota");
        assertThat(forbidden).isExactlyInstanceOf(DriverException.class);
        assertThat(forbidden.isRetryable()).isFalse();
    }

    private static DriverException translate(int code, String body) {
        return KubernetesErrors.translate("create deployment mcp-weather", new ApiException(code, Map.of(), body));
    }
}
