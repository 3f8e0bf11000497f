package ai.tabular.translator.engine;

import ai.tabular.translator.table.CellRef;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome for one {@link TranslationUnit}; either translated text or a failure status.
 */
public record TranslationResult(CellRef cell, Status status, Optional<String> text, Optional<String> detail) {

    public enum Status {
        TRANSLATED,
        FAILED,
        UNSUPPORTED_LANGUAGE,
        CANCELLED
    }

    public TranslationResult {
        Objects.requireNonNull(cell, "cell");
        Objects.requireNonNull(status, "status");
        text = text == null ? Optional.empty() : text;
        detail = detail == null ? Optional.empty() : detail;
        if (status == Status.TRANSLATED && text.isEmpty()) {
            throw new IllegalArgumentException("translated result requires text");
        }
    }

    public static TranslationResult translated(CellRef cell, String text) {
        return new TranslationResult(cell, Status.TRANSLATED, Optional.of(text), Optional.empty());
    }

    public static TranslationResult failed(CellRef cell, String detail) {
        return new TranslationResult(cell, Status.FAILED, Optional.empty(), Optional.ofNullable(detail));
    }

    public static TranslationResult unsupported(CellRef cell, String languageCode) {
        return new TranslationResult(cell, Status.UNSUPPORTED_LANGUAGE, Optional.empty(), Optional.of(languageCode));
    }

    public static TranslationResult cancelled(CellRef cell) {
        return new TranslationResult(cell, Status.CANCELLED, Optional.empty(), Optional.empty());
    }

    public boolean isSuccess() {
        return status == Status.TRANSLATED;
    }
}
