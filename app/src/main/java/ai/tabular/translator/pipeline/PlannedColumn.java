package ai.tabular.translator.pipeline;

import java.util.Objects;

/**
 * A derived column and where it goes.
 *
 * @param sourceColumn selected source column id
 * @param derivedColumn output column id holding the translation
 * @param insertionPosition original index of the source column plus one
 */
public record PlannedColumn(String sourceColumn, String derivedColumn, int insertionPosition) {

    public PlannedColumn {
        Objects.requireNonNull(sourceColumn, "sourceColumn");
        Objects.requireNonNull(derivedColumn, "derivedColumn");
        if (insertionPosition < 1) {
            throw new IllegalArgumentException("insertionPosition must be at least 1");
        }
    }
}
