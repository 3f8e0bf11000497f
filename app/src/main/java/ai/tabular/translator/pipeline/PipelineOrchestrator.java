package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.EngineAdapter;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.EngineRouter;
import ai.tabular.translator.engine.TranslationResult;
import ai.tabular.translator.engine.TranslationUnit;
import ai.tabular.translator.language.ClassificationResult;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.language.LanguageClassifier;
import ai.tabular.translator.table.Cell;
import ai.tabular.translator.table.CellRef;
import ai.tabular.translator.table.Table;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one pass over a table: plan the output columns, classify every cell of the selected
 * columns, route and batch the cells that need translation, dispatch the batches and
 * assemble the output table by cell reference.
 */
public class PipelineOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final int MAX_WARNINGS = 50;

    private final LanguageClassifier classifier;
    private final EngineRouter router;
    private final BatchScheduler scheduler;
    private final ColumnProjector projector;
    private final String targetLanguage;
    private final BatchDispatcher dispatcher = new BatchDispatcher();
    private ProgressListener progressListener = ProgressListener.NONE;

    public PipelineOrchestrator(LanguageClassifier classifier,
                                EngineRouter router,
                                BatchScheduler scheduler,
                                ColumnProjector projector,
                                String targetLanguage) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.router = Objects.requireNonNull(router, "router");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    public void setProgressListener(ProgressListener progressListener) {
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
    }

    public PipelineOutcome run(Table table, List<String> selectedColumns, RunControl control) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(control, "control");
        long started = System.nanoTime();
        ColumnPlan plan = projector.plan(table.columnIds(), selectedColumns);
        LOGGER.info("Translating {} column(s) of {} rows with {}: {}",
                plan.columns().size(), table.rowCount(), router.selected().id(), plan.sourceColumns());

        Map<CellRef, ClassificationResult> classifications = new LinkedHashMap<>();
        List<TranslationUnit> units = classify(table, plan, classifications);

        Map<CellRef, TranslationResult> results = new HashMap<>();
        Map<EngineAdapter, List<TranslationUnit>> routed = route(units, classifications, results);

        Map<EngineAdapter, List<Batch>> batches = new LinkedHashMap<>();
        for (Map.Entry<EngineAdapter, List<TranslationUnit>> entry : routed.entrySet()) {
            List<Batch> scheduled = scheduler.schedule(entry.getValue(), entry.getKey().capability());
            LOGGER.info("{}: {} units in {} batches", entry.getKey().id(), entry.getValue().size(), scheduled.size());
            batches.put(entry.getKey(), scheduled);
        }

        for (TranslationResult result : dispatchAll(batches, units.size(), control)) {
            results.put(result.cell(), result);
        }

        Table output = projector.assemble(table, plan, classifications, results);
        Map<EngineId, Integer> unitsPerEngine = new EnumMap<>(EngineId.class);
        routed.forEach((engine, engineUnits) -> unitsPerEngine.merge(engine.id(), engineUnits.size(), Integer::sum));
        return summarize(output, plan, classifications, results, unitsPerEngine,
                Duration.ofNanos(System.nanoTime() - started), control.isCancelled());
    }

    private List<TranslationUnit> classify(Table table, ColumnPlan plan, Map<CellRef, ClassificationResult> classifications) {
        List<TranslationUnit> units = new ArrayList<>();
        for (String column : plan.sourceColumns()) {
            MDC.put("column", column);
            try {
                for (Cell cell : table.column(column)) {
                    ClassificationResult result = classifier.classify(cell);
                    classifications.put(cell.ref(), result);
                    if (result.needsTranslation()) {
                        units.add(new TranslationUnit(cell.ref(), cell.text(), result.languageCode(), targetLanguage));
                    }
                }
            } finally {
                MDC.remove("column");
            }
        }
        LOGGER.info("Classified {} cells; {} need translation", classifications.size(), units.size());
        return units;
    }

    private Map<EngineAdapter, List<TranslationUnit>> route(List<TranslationUnit> units,
                                                            Map<CellRef, ClassificationResult> classifications,
                                                            Map<CellRef, TranslationResult> results) {
        Map<EngineAdapter, List<TranslationUnit>> routed = new LinkedHashMap<>();
        for (EngineAdapter engine : router.engines()) {
            routed.put(engine, new ArrayList<>());
        }
        for (TranslationUnit unit : units) {
            Optional<EngineAdapter> engine = router.route(unit);
            if (engine.isPresent()) {
                routed.get(engine.get()).add(unit);
                if (engine.get() != router.selected()) {
                    LOGGER.debug("Rerouting {} ({}) to {}", unit.cell(), unit.sourceLanguage(), engine.get().id());
                }
            } else {
                LOGGER.warn("No engine supports {} for {}", unit.languagePair(), unit.cell());
                classifications.computeIfPresent(unit.cell(),
                        (ref, result) -> result.withDecision(Decision.UNSUPPORTED_LANGUAGE));
                results.put(unit.cell(), TranslationResult.unsupported(unit.cell(), unit.sourceLanguage()));
            }
        }
        routed.values().removeIf(List::isEmpty);
        return routed;
    }

    /**
     * The first engine with work runs on the calling thread; any further engine runs on its
     * own worker so that both backends are busy at the same time.
     */
    private List<TranslationResult> dispatchAll(Map<EngineAdapter, List<Batch>> batches, int totalUnits, RunControl control) {
        List<TranslationResult> collected = new ArrayList<>(totalUnits);
        if (batches.isEmpty()) {
            return collected;
        }
        List<Map.Entry<EngineAdapter, List<Batch>>> entries = new ArrayList<>(batches.entrySet());
        Map.Entry<EngineAdapter, List<Batch>> first = entries.get(0);
        List<Map.Entry<EngineAdapter, List<Batch>>> others = entries.subList(1, entries.size());
        if (others.isEmpty()) {
            collected.addAll(dispatchEngine(first.getKey(), first.getValue(), control, totalUnits, 0, true));
            return collected;
        }
        ExecutorService executor = Executors.newFixedThreadPool(others.size(), runnable -> {
            Thread thread = new Thread(runnable, "engine-dispatch");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<List<TranslationResult>>> futures = new ArrayList<>();
            for (Map.Entry<EngineAdapter, List<Batch>> entry : others) {
                futures.add(executor.submit(() -> dispatchEngine(entry.getKey(), entry.getValue(), control, totalUnits, 0, false)));
            }
            List<TranslationResult> own = dispatchEngine(first.getKey(), first.getValue(), control, totalUnits, 0, true);
            collected.addAll(own);
            int completed = own.size();
            for (int i = 0; i < futures.size(); i++) {
                List<TranslationResult> engineResults = awaitEngine(futures.get(i), others.get(i).getValue());
                collected.addAll(engineResults);
                completed += engineResults.size();
                progressListener.onProgress(completed, totalUnits, others.get(i).getKey().id() + " finished");
            }
        } finally {
            executor.shutdownNow();
        }
        return collected;
    }

    private List<TranslationResult> dispatchEngine(EngineAdapter engine, List<Batch> batches, RunControl control,
                                                   int totalUnits, int alreadyCompleted, boolean reportProgress) {
        MDC.put("engine", engine.id().label());
        try {
            List<TranslationResult> results = new ArrayList<>();
            int completed = alreadyCompleted;
            for (Batch batch : batches) {
                if (control.isCancelled()) {
                    for (TranslationUnit unit : batch.units()) {
                        results.add(TranslationResult.cancelled(unit.cell()));
                    }
                    continue;
                }
                results.addAll(dispatcher.dispatch(engine, batch));
                completed += batch.size();
                if (reportProgress) {
                    progressListener.onProgress(completed, totalUnits,
                            "Translated batch of " + batch.size() + " (" + batch.languagePair() + ")");
                }
            }
            return results;
        } finally {
            MDC.remove("engine");
        }
    }

    private List<TranslationResult> awaitEngine(Future<List<TranslationResult>> future, List<Batch> batches) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for engine results");
            return failBatches(batches, "interrupted");
        } catch (ExecutionException ex) {
            LOGGER.error("Engine worker failed: {}", ex.getCause().getMessage(), ex.getCause());
            return failBatches(batches, ex.getCause().getMessage());
        }
    }

    private List<TranslationResult> failBatches(List<Batch> batches, String detail) {
        List<TranslationResult> failed = new ArrayList<>();
        for (Batch batch : batches) {
            for (TranslationUnit unit : batch.units()) {
                failed.add(TranslationResult.failed(unit.cell(), detail));
            }
        }
        return failed;
    }

    private PipelineOutcome summarize(Table output,
                                      ColumnPlan plan,
                                      Map<CellRef, ClassificationResult> classifications,
                                      Map<CellRef, TranslationResult> results,
                                      Map<EngineId, Integer> unitsPerEngine,
                                      Duration elapsed,
                                      boolean cancelled) {
        Map<Decision, Integer> decisionCounts = new EnumMap<>(Decision.class);
        for (ClassificationResult classification : classifications.values()) {
            decisionCounts.merge(classification.decision(), 1, Integer::sum);
        }
        int translated = 0;
        int failed = 0;
        List<String> warnings = new ArrayList<>();
        for (ClassificationResult classification : classifications.values()) {
            TranslationResult result = results.get(classification.cell());
            if (result != null && result.isSuccess()) {
                translated++;
                continue;
            }
            String problem = describeProblem(classification, result);
            if (problem == null) {
                continue;
            }
            failed++;
            if (warnings.size() < MAX_WARNINGS) {
                CellRef ref = classification.cell();
                warnings.add("Row " + (ref.row() + 1) + ", column '" + ref.columnId() + "': " + problem);
            }
        }
        LOGGER.info("Run finished in {} ms: {} translated, {} failed, decisions {}",
                elapsed.toMillis(), translated, failed, decisionCounts);
        return new PipelineOutcome(output, plan, decisionCounts, unitsPerEngine, translated, failed,
                warnings, elapsed, cancelled);
    }

    private String describeProblem(ClassificationResult classification, TranslationResult result) {
        return switch (classification.decision()) {
            case MALFORMED_CELL -> "malformed cell text";
            case UNSUPPORTED_LANGUAGE -> "unsupported language " + classification.languageCode();
            case TRANSLATE -> result == null
                    ? "no translation produced"
                    : switch (result.status()) {
                        case TRANSLATED -> null;
                        case FAILED -> "translation failed" + result.detail().map(detail -> " (" + detail + ")").orElse("");
                        case UNSUPPORTED_LANGUAGE -> "unsupported language " + result.detail().orElse(classification.languageCode());
                        case CANCELLED -> "cancelled";
                    };
            default -> null;
        };
    }
}
