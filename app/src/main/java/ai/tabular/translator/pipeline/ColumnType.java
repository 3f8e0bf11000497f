package ai.tabular.translator.pipeline;

/**
 * Content type inferred for a column from a sample of its cells.
 */
public enum ColumnType {
    EMPTY("empty"),
    NUMERIC("numeric"),
    DATE("date"),
    ENGLISH("english"),
    FOREIGN_TEXT("foreign-text"),
    MIXED("mixed");

    private final String label;

    ColumnType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean needsTranslation() {
        return this == FOREIGN_TEXT || this == MIXED;
    }
}
