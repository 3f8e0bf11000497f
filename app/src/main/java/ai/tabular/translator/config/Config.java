package ai.tabular.translator.config;

import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationMode;
import ai.tabular.translator.language.SkipRules;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable run configuration assembled from CLI arguments, environment values and defaults.
 * Language codes are already normalized to the internal vocabulary.
 */
public record Config(
        Path input,
        Path output,
        List<String> columns,
        EngineId engine,
        String targetLanguage,
        double confidenceThreshold,
        String fallbackLanguage,
        int batchSize,
        SkipRules skipRules,
        Optional<String> forcedLanguage,
        boolean engineFallback,
        TranslationMode translationMode,
        LogFormat logFormat,
        BackendConfig backendConfig
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output must differ from input: " + output);
        }
        columns = columns == null ? List.of() : List.copyOf(new LinkedHashSet<>(columns));
        Objects.requireNonNull(engine, "engine");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
        fallbackLanguage = requireNonBlank(fallbackLanguage, "fallbackLanguage");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        Objects.requireNonNull(skipRules, "skipRules");
        forcedLanguage = forcedLanguage == null ? Optional.empty() : forcedLanguage;
        Objects.requireNonNull(translationMode, "translationMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(backendConfig, "backendConfig");
    }

    public boolean autoSelectColumns() {
        return columns.isEmpty();
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
