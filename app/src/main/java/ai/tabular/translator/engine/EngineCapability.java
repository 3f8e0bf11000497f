package ai.tabular.translator.engine;

import java.util.Objects;
import java.util.Set;

/**
 * Static description of what an engine can translate and how many units it accepts per call.
 */
public record EngineCapability(EngineId engineId, Set<String> supportedLanguages, int maxBatchSize) {

    public EngineCapability {
        Objects.requireNonNull(engineId, "engineId");
        supportedLanguages = Set.copyOf(Objects.requireNonNull(supportedLanguages, "supportedLanguages"));
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1");
        }
    }

    public boolean supports(String languageCode) {
        return languageCode != null && supportedLanguages.contains(languageCode);
    }

    /**
     * Caps the engine limit with a run-level override.
     */
    public int effectiveBatchSize(int requested) {
        return Math.max(1, Math.min(maxBatchSize, requested));
    }
}
