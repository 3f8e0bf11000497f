package ai.tabular.translator.table;

import java.util.Objects;

/**
 * Stable identity of a cell: zero based data row index and column id.
 */
public record CellRef(int row, String columnId) {

    public CellRef {
        if (row < 0) {
            throw new IllegalArgumentException("row must not be negative");
        }
        Objects.requireNonNull(columnId, "columnId");
    }

    @Override
    public String toString() {
        return columnId + "[" + (row + 1) + "]";
    }
}
