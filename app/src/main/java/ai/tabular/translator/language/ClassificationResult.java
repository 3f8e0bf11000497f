package ai.tabular.translator.language;

import ai.tabular.translator.table.CellRef;
import java.util.Objects;

/**
 * Tagged per-cell record produced exactly once for every cell of a selected column.
 */
public record ClassificationResult(CellRef cell, String languageCode, double confidence, Decision decision) {

    public ClassificationResult {
        Objects.requireNonNull(cell, "cell");
        Objects.requireNonNull(languageCode, "languageCode");
        Objects.requireNonNull(decision, "decision");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
    }

    public static ClassificationResult skipped(CellRef cell, Decision decision) {
        return new ClassificationResult(cell, LanguageCatalog.UNKNOWN, 0.0, decision);
    }

    public boolean needsTranslation() {
        return decision == Decision.TRANSLATE;
    }

    public ClassificationResult withDecision(Decision newDecision) {
        return new ClassificationResult(cell, languageCode, confidence, newDecision);
    }
}
