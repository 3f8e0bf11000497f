package ai.tabular.translator.pipeline;

/**
 * Text written into derived cells that could not be translated. Markers are never empty so
 * that consumers can tell a failure apart from a cell with nothing to translate.
 */
public final class ErrorMarkers {

    public static final String TRANSLATION_FAILED = "[TRANSLATION FAILED]";
    public static final String MALFORMED_CELL = "[MALFORMED CELL]";
    public static final String CANCELLED = "[CANCELLED]";

    private ErrorMarkers() {
    }

    public static String unsupportedLanguage(String languageCode) {
        return "[UNSUPPORTED LANGUAGE: " + languageCode + "]";
    }
}
