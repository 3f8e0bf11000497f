package ai.tabular.translator.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Low-level translation model. Codes are in the vocabulary of the engine that owns the
 * backend.
 */
@FunctionalInterface
public interface TranslationBackend {

    String translate(String text, String sourceCode, String targetCode);

    /**
     * Translates texts sharing one language pair in a single model pass where the backend
     * supports it.
     */
    default List<String> translateAll(List<String> texts, String sourceCode, String targetCode) {
        List<String> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            result.add(translate(text, sourceCode, targetCode));
        }
        return result;
    }
}
