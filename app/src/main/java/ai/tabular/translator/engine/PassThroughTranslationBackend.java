package ai.tabular.translator.engine;

/**
 * Backend used for dry runs; returns the source text without loading a model.
 */
public class PassThroughTranslationBackend implements TranslationBackend {

    @Override
    public String translate(String text, String sourceCode, String targetCode) {
        return text == null ? "" : text;
    }
}
