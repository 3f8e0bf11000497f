package ai.tabular.translator.language;

import java.util.Objects;

/**
 * Raw answer of a language identification model.
 */
public record Detection(String languageCode, double confidence) {

    public Detection {
        Objects.requireNonNull(languageCode, "languageCode");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static Detection unknown() {
        return new Detection(LanguageCatalog.UNKNOWN, 0.0);
    }

    public boolean isUnknown() {
        return LanguageCatalog.UNKNOWN.equals(languageCode);
    }
}
