package sbhackathon.koala.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sbhackathon.koala.orchestrator.dto.CreateDeploymentRequest;
import sbhackathon.koala.orchestrator.dto.UpdateDeploymentRequest;
import sbhackathon.koala.orchestrator.exception.DeploymentValidationException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentRequestValidatorTest {

    private final DeploymentRequestValidator validator = new DeploymentRequestValidator();

    @Test
    void 정상_요청은_통과한다() {
        CreateDeploymentRequest request = new CreateDeploymentRequest("weather", "weather-api", "Development", 3);
        request.setCpuLimit("500m");
        request.setMemoryLimit("512Mi");
        request.setEnvironmentVariables(Map.of("API_KEY", "secret"));
        request.setHealthCheckPath("/health");
        request.setHealthCheckIntervalSeconds(30);

        assertThatCode(() -> validator.validateCreate(request)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Weather", "-weather", "weather-", "weather_api", "weather api"})
    void 이름_규칙을_어기면_거부한다(String name) {
        CreateDeploymentRequest request = new CreateDeploymentRequest("weather", name, "development", 1);

        assertThatThrownBy(() -> validator.validateCreate(request))
                .isInstanceOf(DeploymentValidationException.class);
    }

    @Test
    void 이름은_50자까지_허용한다() {
        assertThatCode(() -> validator.validateCreate(
                new CreateDeploymentRequest("weather", "a".repeat(50), "development", 1)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateCreate(
                new CreateDeploymentRequest("weather", "a".repeat(51), "development", 1)))
                .isInstanceOf(DeploymentValidationException.class)
                .hasMessageContaining("50");
    }

    @Test
    void 알_수_없는_환경은_거부한다() {
        CreateDeploymentRequest request = new CreateDeploymentRequest("weather", "weather", "qa", 1);

        assertThatThrownBy(() -> validator.validateCreate(request))
                .isInstanceOf(DeploymentValidationException.class)
                .hasMessageContaining("qa");
    }

    @Test
    void mcpServerId가_없으면_거부한다() {
        CreateDeploymentRequest request = new CreateDeploymentRequest(" ", "weather", "development", 1);

        assertThatThrownBy(() -> validator.validateCreate(request))
                .isInstanceOf(DeploymentValidationException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 11, -1})
    void replica_범위를_벗어나면_거부한다(int replicas) {
        assertThatThrownBy(() -> validator.validateReplicas(replicas))
                .isInstanceOf(DeploymentValidationException.class);
    }

    @Test
    void replica는_1부터_10까지_허용한다() {
        assertThatCode(() -> {
            validator.validateReplicas(1);
            validator.validateReplicas(10);
        }).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateReplicas(null))
                .isInstanceOf(DeploymentValidationException.class);
    }

    @Test
    void 헬스체크_주기는_10초에서_300초_사이여야_한다() {
        UpdateDeploymentRequest tooShort = new UpdateDeploymentRequest();
        tooShort.setHealthCheckIntervalSeconds(5);
        UpdateDeploymentRequest tooLong = new UpdateDeploymentRequest();
        tooLong.setHealthCheckIntervalSeconds(301);

        assertThatThrownBy(() -> validator.validateUpdate(tooShort)).isInstanceOf(DeploymentValidationException.class);
        assertThatThrownBy(() -> validator.validateUpdate(tooLong)).isInstanceOf(DeploymentValidationException.class);
    }

    @Test
    void 리소스_제한_형식이_잘못되면_거부한다() {
        UpdateDeploymentRequest request = new UpdateDeploymentRequest();
        request.setMemoryLimit("lots");

        assertThatThrownBy(() -> validator.validateUpdate(request))
                .isInstanceOf(DeploymentValidationException.class)
                .hasMessageContaining("memoryLimit");
    }

    @Test
    void 헬스체크_경로와_환경변수_이름을_검증한다() {
        UpdateDeploymentRequest badPath = new UpdateDeploymentRequest();
        badPath.setHealthCheckPath("health");
        UpdateDeploymentRequest badKey = new UpdateDeploymentRequest();
        badKey.setEnvironmentVariables(Map.of("1BAD", "x"));

        assertThatThrownBy(() -> validator.validateUpdate(badPath)).isInstanceOf(DeploymentValidationException.class);
        assertThatThrownBy(() -> validator.validateUpdate(badKey)).isInstanceOf(DeploymentValidationException.class);
    }

    @Test
    void 로그_tail은_1에서_10000_사이여야_한다() {
        assertThatThrownBy(() -> validator.validateLogTail(0)).isInstanceOf(DeploymentValidationException.class);
        assertThatThrownBy(() -> validator.validateLogTail(10_001)).isInstanceOf(DeploymentValidationException.class);
        assertThatCode(() -> validator.validateLogTail(100)).doesNotThrowAnyException();
    }
}
