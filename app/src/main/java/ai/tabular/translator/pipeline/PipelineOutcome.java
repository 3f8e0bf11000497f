package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.table.Table;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of one pipeline run.
 */
public record PipelineOutcome(Table table,
                              ColumnPlan plan,
                              Map<Decision, Integer> decisionCounts,
                              Map<EngineId, Integer> unitsPerEngine,
                              int cellsTranslated,
                              int cellsFailed,
                              List<String> warnings,
                              Duration elapsed,
                              boolean cancelled) {

    public PipelineOutcome {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(plan, "plan");
        decisionCounts = Map.copyOf(Objects.requireNonNull(decisionCounts, "decisionCounts"));
        unitsPerEngine = Map.copyOf(Objects.requireNonNull(unitsPerEngine, "unitsPerEngine"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public int count(Decision decision) {
        return decisionCounts.getOrDefault(decision, 0);
    }

    public int columnsTranslated() {
        return plan.columns().size();
    }
}
