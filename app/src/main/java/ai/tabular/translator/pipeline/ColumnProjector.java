package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.TranslationResult;
import ai.tabular.translator.language.ClassificationResult;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.table.CellRef;
import ai.tabular.translator.table.Table;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Places each translated column right after its source column and fills it from the
 * per-cell results.
 */
public class ColumnProjector {

    private final String suffix;

    /**
     * @param targetIsoCode short target code used in derived column names, e.g. {@code en}
     */
    public ColumnProjector(String targetIsoCode) {
        if (targetIsoCode == null || targetIsoCode.isBlank()) {
            throw new IllegalArgumentException("targetIsoCode must not be blank");
        }
        this.suffix = "_" + targetIsoCode;
    }

    public ColumnPlan plan(List<String> columnIds, List<String> selectedColumns) {
        Objects.requireNonNull(columnIds, "columnIds");
        Set<String> selected = new LinkedHashSet<>(Objects.requireNonNull(selectedColumns, "selectedColumns"));
        for (String column : selected) {
            if (!columnIds.contains(column)) {
                throw new IllegalArgumentException("Unknown column selected for translation: " + column);
            }
        }
        Set<String> taken = new HashSet<>(columnIds);
        List<PlannedColumn> planned = new ArrayList<>();
        List<String> output = new ArrayList<>(columnIds.size() + selected.size());
        for (int index = 0; index < columnIds.size(); index++) {
            String column = columnIds.get(index);
            output.add(column);
            if (!selected.contains(column)) {
                continue;
            }
            String derived = uniqueName(column + suffix, taken);
            taken.add(derived);
            planned.add(new PlannedColumn(column, derived, index + 1));
            output.add(derived);
        }
        return new ColumnPlan(planned, output);
    }

    public Table assemble(Table original,
                          ColumnPlan plan,
                          Map<CellRef, ClassificationResult> classifications,
                          Map<CellRef, TranslationResult> results) {
        List<List<String>> rows = new ArrayList<>(original.rowCount());
        for (int r = 0; r < original.rowCount(); r++) {
            List<String> source = original.row(r);
            List<String> row = new ArrayList<>(plan.outputColumns().size());
            for (int c = 0; c < original.columnCount(); c++) {
                String column = original.columnIds().get(c);
                row.add(source.get(c));
                if (plan.forSource(column).isPresent()) {
                    CellRef ref = new CellRef(r, column);
                    row.add(derivedValue(source.get(c), classifications.get(ref), results.get(ref), ref));
                }
            }
            rows.add(row);
        }
        return new Table(plan.outputColumns(), rows);
    }

    private String derivedValue(String sourceText, ClassificationResult classification,
                                TranslationResult result, CellRef ref) {
        if (classification == null) {
            throw new IllegalStateException("No classification recorded for " + ref);
        }
        Decision decision = classification.decision();
        if (decision.keepsSourceText()) {
            return sourceText;
        }
        return switch (decision) {
            case MALFORMED_CELL -> ErrorMarkers.MALFORMED_CELL;
            case UNSUPPORTED_LANGUAGE -> ErrorMarkers.unsupportedLanguage(classification.languageCode());
            default -> fromResult(result, classification);
        };
    }

    private String fromResult(TranslationResult result, ClassificationResult classification) {
        if (result == null) {
            return ErrorMarkers.TRANSLATION_FAILED;
        }
        return switch (result.status()) {
            case TRANSLATED -> result.text().orElse(ErrorMarkers.TRANSLATION_FAILED);
            case FAILED -> ErrorMarkers.TRANSLATION_FAILED;
            case UNSUPPORTED_LANGUAGE -> ErrorMarkers.unsupportedLanguage(
                    result.detail().orElse(classification.languageCode()));
            case CANCELLED -> ErrorMarkers.CANCELLED;
        };
    }

    private static String uniqueName(String candidate, Set<String> taken) {
        if (!taken.contains(candidate)) {
            return candidate;
        }
        int counter = 2;
        while (taken.contains(candidate + "_" + counter)) {
            counter++;
        }
        return candidate + "_" + counter;
    }
}
