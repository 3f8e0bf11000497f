package ai.tabular.translator.language;

/**
 * Pre-trained language identification model. Implementations return internal language
 * codes from {@link LanguageCatalog}, or {@link Detection#unknown()}.
 */
@FunctionalInterface
public interface LanguageIdentifier {

    Detection detect(String text);
}
