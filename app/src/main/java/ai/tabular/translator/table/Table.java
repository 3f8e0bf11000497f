package ai.tabular.translator.table;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable ordered table of string cells with unique column ids.
 */
public final class Table {

    private final List<String> columnIds;
    private final List<List<String>> rows;
    private final Map<String, Integer> columnIndex;

    public Table(List<String> columnIds, List<List<String>> rows) {
        Objects.requireNonNull(columnIds, "columnIds");
        Objects.requireNonNull(rows, "rows");
        this.columnIds = List.copyOf(columnIds);
        this.columnIndex = new HashMap<>();
        for (int i = 0; i < this.columnIds.size(); i++) {
            if (columnIndex.put(this.columnIds.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column id: " + this.columnIds.get(i));
            }
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.size() > this.columnIds.size()) {
                throw new IllegalArgumentException("Row " + (r + 1) + " has " + row.size()
                        + " values but the table has " + this.columnIds.size() + " columns");
            }
            List<String> normalized = new ArrayList<>(this.columnIds.size());
            for (int c = 0; c < this.columnIds.size(); c++) {
                String value = c < row.size() ? row.get(c) : null;
                normalized.add(value == null ? "" : value);
            }
            copy.add(List.copyOf(normalized));
        }
        this.rows = List.copyOf(copy);
    }

    public List<String> columnIds() {
        return columnIds;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnIds.size();
    }

    public boolean hasColumn(String columnId) {
        return columnIndex.containsKey(columnId);
    }

    public int columnIndex(String columnId) {
        Integer index = columnIndex.get(columnId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column: " + columnId);
        }
        return index;
    }

    public List<String> row(int row) {
        return rows.get(row);
    }

    public List<List<String>> rows() {
        return rows;
    }

    public String value(int row, String columnId) {
        return rows.get(row).get(columnIndex(columnId));
    }

    public Cell cell(int row, String columnId) {
        return new Cell(new CellRef(row, columnId), value(row, columnId));
    }

    public List<Cell> column(String columnId) {
        int index = columnIndex(columnId);
        List<Cell> cells = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            cells.add(new Cell(new CellRef(r, columnId), rows.get(r).get(index)));
        }
        return cells;
    }
}
