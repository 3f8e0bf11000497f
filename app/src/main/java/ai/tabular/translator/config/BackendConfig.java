package ai.tabular.translator.config;

import ai.tabular.translator.engine.EngineId;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the locally hosted models behind the two engines.
 */
public record BackendConfig(String baseUrl, String engineAModel, String engineBModel, Duration timeout) {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_ENGINE_A_MODEL = "nllb-200-distilled-600m";
    public static final String DEFAULT_ENGINE_B_MODEL = "qwen2.5:1.5b";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    public BackendConfig {
        baseUrl = requireNonBlank(baseUrl, "baseUrl");
        engineAModel = requireNonBlank(engineAModel, "engineAModel");
        engineBModel = requireNonBlank(engineBModel, "engineBModel");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static BackendConfig defaults() {
        return new BackendConfig(DEFAULT_BASE_URL, DEFAULT_ENGINE_A_MODEL, DEFAULT_ENGINE_B_MODEL, DEFAULT_TIMEOUT);
    }

    public String modelFor(EngineId engineId) {
        return switch (engineId) {
            case ENGINE_A -> engineAModel;
            case ENGINE_B -> engineBModel;
        };
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
