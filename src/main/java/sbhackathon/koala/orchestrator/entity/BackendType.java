package sbhackathon.koala.orchestrator.entity;

import java.util.Locale;

public enum BackendType {
    DOCKER,
    KUBERNETES;

    public static BackendType fromValue(String value) {
        return BackendType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
