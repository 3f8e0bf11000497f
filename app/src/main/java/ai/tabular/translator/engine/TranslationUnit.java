package ai.tabular.translator.engine;

import ai.tabular.translator.table.CellRef;
import java.util.Objects;

/**
 * Work item for a cell whose classification decided it must be translated.
 */
public record TranslationUnit(CellRef cell, String sourceText, String sourceLanguage, String targetLanguage) {

    public TranslationUnit {
        Objects.requireNonNull(cell, "cell");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    public LanguagePair languagePair() {
        return new LanguagePair(sourceLanguage, targetLanguage);
    }

    public record LanguagePair(String source, String target) {
        @Override
        public String toString() {
            return source + "->" + target;
        }
    }
}
