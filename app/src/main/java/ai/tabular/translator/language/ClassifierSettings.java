package ai.tabular.translator.language;

import java.util.Objects;
import java.util.Optional;

/**
 * Confidence gating and force-language settings for {@link LanguageClassifier}.
 */
public record ClassifierSettings(double confidenceThreshold,
                                 String fallbackLanguage,
                                 String targetLanguage,
                                 Optional<String> forcedLanguage) {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    public ClassifierSettings {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]");
        }
        Objects.requireNonNull(fallbackLanguage, "fallbackLanguage");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
        forcedLanguage = forcedLanguage == null ? Optional.empty() : forcedLanguage;
    }

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(DEFAULT_CONFIDENCE_THRESHOLD, LanguageCatalog.ENGLISH,
                LanguageCatalog.ENGLISH, Optional.empty());
    }
}
