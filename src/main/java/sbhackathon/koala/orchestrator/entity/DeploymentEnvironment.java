package sbhackathon.koala.orchestrator.entity;

import java.util.Locale;

public enum DeploymentEnvironment {
    DEVELOPMENT,
    STAGING,
    PRODUCTION;

    /**
     * "development", "Staging" 같은 입력을 대소문자 구분 없이 변환합니다.
     *
     * @throws IllegalArgumentException 알 수 없는 환경 이름인 경우
     */
    public static DeploymentEnvironment fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("environment is required");
        }
        return DeploymentEnvironment.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
