package ai.tabular.translator.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of sampling one column.
 */
public record ColumnAnalysis(String columnId,
                             ColumnType type,
                             int sampledCells,
                             Optional<String> dominantLanguage,
                             double averageConfidence,
                             boolean autoSelected) {

    public ColumnAnalysis {
        Objects.requireNonNull(columnId, "columnId");
        Objects.requireNonNull(type, "type");
        dominantLanguage = dominantLanguage == null ? Optional.empty() : dominantLanguage;
    }
}
