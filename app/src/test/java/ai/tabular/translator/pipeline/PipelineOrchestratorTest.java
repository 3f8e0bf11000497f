package ai.tabular.translator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import ai.tabular.translator.engine.BackendResourceException;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.EngineRouter;
import ai.tabular.translator.engine.TranslationResult;
import ai.tabular.translator.engine.TranslationUnit;
import ai.tabular.translator.language.ClassifierSettings;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.language.Detection;
import ai.tabular.translator.language.LanguageClassifier;
import ai.tabular.translator.language.LanguageIdentifier;
import ai.tabular.translator.language.SkipRuleEvaluator;
import ai.tabular.translator.language.SkipRules;
import ai.tabular.translator.table.Table;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

class PipelineOrchestratorTest {

    private static final String ENGLISH = "eng_Latn";
    private static final Set<String> BROAD = Set.of(ENGLISH, "rus_Cyrl", "deu_Latn", "swh_Latn", "spa_Latn");
    private static final Set<String> LIGHT = Set.of(ENGLISH, "rus_Cyrl", "deu_Latn", "spa_Latn");

    /** Cyrillic is Russian, words ending in -o are Spanish, "Jambo"-style text is Swahili, the rest is German. */
    private static final LanguageIdentifier IDENTIFIER = text -> {
        if (text.chars().anyMatch(ch -> Character.UnicodeBlock.of(ch) == Character.UnicodeBlock.CYRILLIC)) {
            return new Detection("rus_Cyrl", 0.95);
        }
        if (text.startsWith("Jambo")) {
            return new Detection("swh_Latn", 0.9);
        }
        if (text.endsWith("o")) {
            return new Detection("spa_Latn", 0.85);
        }
        return new Detection("deu_Latn", 0.8);
    };

    private static LanguageClassifier classifier(LanguageIdentifier identifier, double threshold) {
        return new LanguageClassifier(identifier, new SkipRuleEvaluator(), SkipRules.all(),
                new ClassifierSettings(threshold, ENGLISH, ENGLISH, Optional.empty()));
    }

    private static PipelineOrchestrator orchestrator(LanguageClassifier classifier, EngineRouter router, int batchSize) {
        return new PipelineOrchestrator(classifier, router, new BatchScheduler(batchSize), new ColumnProjector("en"), ENGLISH);
    }

    private static Table commentTable(String... comments) {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < comments.length; i++) {
            rows.add(List.of(String.valueOf(i + 1), comments[i]));
        }
        return new Table(List.of("id", "comment"), rows);
    }

    private static List<String> column(Table table, String column) {
        List<String> values = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            values.add(table.value(row, column));
        }
        return values;
    }

    @Test
    void translatesForeignCellsAndKeepsSkippedOnes() {
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 16);
        Table table = commentTable("", "Отличный продукт!", "123", "2024-01-01", "Hello");

        PipelineOutcome outcome = orchestrator.run(table, List.of("comment"), new RunControl());

        assertThat(outcome.table().columnIds()).containsExactly("id", "comment", "comment_en");
        assertThat(column(outcome.table(), "comment_en"))
                .containsExactly("", "EN(Отличный продукт!)", "123", "2024-01-01", "Hello");
        assertThat(outcome.count(Decision.SKIP_EMPTY)).isEqualTo(1);
        assertThat(outcome.count(Decision.SKIP_NUMERIC)).isEqualTo(1);
        assertThat(outcome.count(Decision.SKIP_DATE)).isEqualTo(1);
        assertThat(outcome.count(Decision.SKIP_ENGLISH)).isEqualTo(1);
        assertThat(outcome.count(Decision.TRANSLATE)).isEqualTo(1);
        assertThat(outcome.cellsTranslated()).isEqualTo(1);
        assertThat(outcome.cellsFailed()).isZero();
        assertThat(outcome.cancelled()).isFalse();
        assertThat(engineA.batchSizes).containsExactly(1);
    }

    @Test
    void lowConfidenceCellsKeepTheirText() {
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        LanguageClassifier classifier = classifier(text -> new Detection("deu_Latn", 0.5), 0.9);
        PipelineOrchestrator orchestrator = orchestrator(classifier, new EngineRouter(List.of(engineA), true), 16);

        PipelineOutcome outcome = orchestrator.run(commentTable("Gut gemacht"), List.of("comment"), new RunControl());

        assertThat(column(outcome.table(), "comment_en")).containsExactly("Gut gemacht");
        assertThat(outcome.count(Decision.LOW_CONFIDENCE_FALLBACK)).isEqualTo(1);
        assertThat(engineA.batchSizes).isEmpty();
    }

    @Test
    void languagesMissingFromTheSelectedEngineAreRerouted() {
        FakeEngine engineB = FakeEngine.translating(EngineId.ENGINE_B, LIGHT, 32);
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineB, engineA), true), 16);

        PipelineOutcome outcome = orchestrator.run(commentTable("Привет", "Jambo rafiki", "Hola amigo"),
                List.of("comment"), new RunControl());

        assertThat(column(outcome.table(), "comment_en"))
                .containsExactly("EN(Привет)", "EN(Jambo rafiki)", "EN(Hola amigo)");
        assertThat(outcome.unitsPerEngine()).containsEntry(EngineId.ENGINE_B, 2).containsEntry(EngineId.ENGINE_A, 1);
        assertThat(engineA.batchSizes).containsExactly(1);
        assertThat(engineA.threads).containsExactly("engine-dispatch");
    }

    @Test
    void withoutEngineFallbackUnsupportedCellsAreMarked() {
        FakeEngine engineB = FakeEngine.translating(EngineId.ENGINE_B, LIGHT, 32);
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineB, engineA), false), 16);

        PipelineOutcome outcome = orchestrator.run(commentTable("Привет", "Jambo rafiki"), List.of("comment"), new RunControl());

        assertThat(column(outcome.table(), "comment_en")).containsExactly("EN(Привет)", "[UNSUPPORTED LANGUAGE: swh_Latn]");
        assertThat(outcome.count(Decision.UNSUPPORTED_LANGUAGE)).isEqualTo(1);
        assertThat(outcome.cellsFailed()).isEqualTo(1);
        assertThat(outcome.warnings()).singleElement(InstanceOfAssertFactories.STRING).contains("Row 2", "comment", "swh_Latn");
        assertThat(engineA.batchSizes).isEmpty();
    }

    @Test
    void outputDoesNotDependOnRowOrder() {
        List<String> comments = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            comments.add(i % 2 == 0 ? "Привет " + i : "Hola numero" + i + "o");
        }
        Collections.shuffle(comments, new Random(7));
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 4);

        PipelineOutcome outcome = orchestrator.run(commentTable(comments.toArray(new String[0])),
                List.of("comment"), new RunControl());

        for (int row = 0; row < outcome.table().rowCount(); row++) {
            String source = outcome.table().value(row, "comment");
            assertThat(outcome.table().value(row, "comment_en")).isEqualTo("EN(" + source + ")");
        }
        assertThat(engineA.batchSizes).allSatisfy(size -> assertThat(size).isLessThanOrEqualTo(4));
    }

    @Test
    void resourceExhaustedBatchIsRetriedInHalves() {
        FakeEngine translating = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        FakeEngine engineA = new FakeEngine(EngineId.ENGINE_A, BROAD, 16, units -> {
            if (units.size() > 2) {
                throw new BackendResourceException("out of memory", null);
            }
            return translating.translateBatch(units);
        });
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 4);

        PipelineOutcome outcome = orchestrator.run(commentTable("Один", "Два", "Три", "Четыре"),
                List.of("comment"), new RunControl());

        assertThat(engineA.batchSizes).containsExactly(4, 2, 2);
        assertThat(column(outcome.table(), "comment_en")).containsExactly("EN(Один)", "EN(Два)", "EN(Три)", "EN(Четыре)");
    }

    @Test
    void persistentResourceExhaustionFailsTheUnits() {
        FakeEngine engineA = new FakeEngine(EngineId.ENGINE_A, BROAD, 16, units -> {
            throw new BackendResourceException("out of memory", null);
        });
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 16);

        PipelineOutcome outcome = orchestrator.run(commentTable("Один", "Два"), List.of("comment"), new RunControl());

        assertThat(column(outcome.table(), "comment_en")).containsOnly(ErrorMarkers.TRANSLATION_FAILED);
        assertThat(outcome.cellsFailed()).isEqualTo(2);
        assertThat(engineA.batchSizes).containsExactly(2, 1, 1);
    }

    @Test
    void failedUnitsAreMarkedIndividually() {
        FakeEngine engineA = new FakeEngine(EngineId.ENGINE_A, BROAD, 16, units -> {
            List<TranslationResult> results = new ArrayList<>();
            for (TranslationUnit unit : units) {
                results.add(unit.sourceText().contains("сбой")
                        ? TranslationResult.failed(unit.cell(), "model error")
                        : TranslationResult.translated(unit.cell(), "EN(" + unit.sourceText() + ")"));
            }
            return results;
        });
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 16);

        PipelineOutcome outcome = orchestrator.run(commentTable("Привет", "сбой", "Пр\uFFFDвет"),
                List.of("comment"), new RunControl());

        assertThat(column(outcome.table(), "comment_en"))
                .containsExactly("EN(Привет)", ErrorMarkers.TRANSLATION_FAILED, ErrorMarkers.MALFORMED_CELL);
        assertThat(outcome.cellsFailed()).isEqualTo(2);
        assertThat(outcome.count(Decision.MALFORMED_CELL)).isEqualTo(1);
    }

    @Test
    void cancellationStopsBetweenBatches() {
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        PipelineOrchestrator orchestrator = orchestrator(classifier(IDENTIFIER, 0.7),
                new EngineRouter(List.of(engineA), true), 1);
        RunControl control = new RunControl();
        AtomicInteger progressCalls = new AtomicInteger();
        orchestrator.setProgressListener((completed, total, message) -> {
            progressCalls.incrementAndGet();
            control.cancel();
        });

        PipelineOutcome outcome = orchestrator.run(commentTable("Один", "Два", "Три"), List.of("comment"), control);

        assertThat(outcome.cancelled()).isTrue();
        assertThat(engineA.batchSizes).containsExactly(1);
        assertThat(progressCalls).hasValue(1);
        assertThat(column(outcome.table(), "comment_en"))
                .containsExactly("EN(Один)", ErrorMarkers.CANCELLED, ErrorMarkers.CANCELLED);
    }

    @Test
    void onlySelectedColumnsAreClassified() {
        FakeEngine engineA = FakeEngine.translating(EngineId.ENGINE_A, BROAD, 16);
        AtomicInteger detections = new AtomicInteger();
        LanguageClassifier classifier = classifier(text -> {
            detections.incrementAndGet();
            return IDENTIFIER.detect(text);
        }, 0.7);
        Table table = new Table(List.of("title", "body"), List.of(List.of("Привет", "Пока")));

        PipelineOutcome outcome = orchestrator(classifier, new EngineRouter(List.of(engineA), true), 16)
                .run(table, List.of("body"), new RunControl());

        assertThat(outcome.table().columnIds()).containsExactly("title", "body", "body_en");
        assertThat(outcome.table().row(0)).containsExactly("Привет", "Пока", "EN(Пока)");
        assertThat(detections).hasValue(1);
        assertThat(outcome.decisionCounts()).isEqualTo(Map.of(Decision.TRANSLATE, 1));
    }
}
