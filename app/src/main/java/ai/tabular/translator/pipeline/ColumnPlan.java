package ai.tabular.translator.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output layout computed once per run, before any cell is classified.
 */
public record ColumnPlan(List<PlannedColumn> columns, List<String> outputColumns) {

    public ColumnPlan {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        outputColumns = List.copyOf(Objects.requireNonNull(outputColumns, "outputColumns"));
    }

    public List<String> sourceColumns() {
        return columns.stream().map(PlannedColumn::sourceColumn).toList();
    }

    public Optional<PlannedColumn> forSource(String columnId) {
        return columns.stream().filter(column -> column.sourceColumn().equals(columnId)).findFirst();
    }
}
