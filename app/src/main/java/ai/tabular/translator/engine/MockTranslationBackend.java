package ai.tabular.translator.engine;

/**
 * Deterministic stand-in for a model, useful to inspect the output layout.
 */
public class MockTranslationBackend implements TranslationBackend {

    @Override
    public String translate(String text, String sourceCode, String targetCode) {
        return "[MOCK " + sourceCode + "->" + targetCode + "] " + text;
    }
}
