package ai.tabular.translator.language;

/**
 * Per-cell outcome of skip rules and language classification.
 */
public enum Decision {
    TRANSLATE("translate"),
    SKIP_NUMERIC("skip-numeric"),
    SKIP_DATE("skip-date"),
    SKIP_EMPTY("skip-empty"),
    SKIP_ENGLISH("skip-english"),
    LOW_CONFIDENCE_FALLBACK("low-confidence-fallback"),
    UNSUPPORTED_LANGUAGE("unsupported-language-error"),
    MALFORMED_CELL("malformed-cell");

    private final String label;

    Decision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Whether the output cell keeps the source text unchanged.
     */
    public boolean keepsSourceText() {
        return switch (this) {
            case SKIP_NUMERIC, SKIP_DATE, SKIP_EMPTY, SKIP_ENGLISH, LOW_CONFIDENCE_FALLBACK -> true;
            case TRANSLATE, UNSUPPORTED_LANGUAGE, MALFORMED_CELL -> false;
        };
    }
}
