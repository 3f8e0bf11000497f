package ai.tabular.translator.pipeline;

import ai.tabular.translator.language.ClassificationResult;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.language.LanguageClassifier;
import ai.tabular.translator.table.Cell;
import ai.tabular.translator.table.Table;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the non-empty cells of every column and infers whether the column carries text
 * that needs translation. Used to pick columns when none are given explicitly.
 */
public class ColumnAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnAnalyzer.class);

    public static final int DEFAULT_SAMPLE_SIZE = 50;
    static final double DOMINANT_SHARE = 0.8;

    private final LanguageClassifier classifier;
    private final int sampleSize;

    public ColumnAnalyzer(LanguageClassifier classifier) {
        this(classifier, DEFAULT_SAMPLE_SIZE);
    }

    public ColumnAnalyzer(LanguageClassifier classifier, int sampleSize) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive");
        }
        this.sampleSize = sampleSize;
    }

    public List<ColumnAnalysis> analyze(Table table) {
        Objects.requireNonNull(table, "table");
        List<ColumnAnalysis> analyses = new ArrayList<>(table.columnCount());
        for (String column : table.columnIds()) {
            ColumnAnalysis analysis = analyzeColumn(column, sample(table.column(column)));
            LOGGER.debug("Column '{}' looks {} ({} sampled, language {})", column, analysis.type().label(),
                    analysis.sampledCells(), analysis.dominantLanguage().orElse("-"));
            analyses.add(analysis);
        }
        return analyses;
    }

    public List<String> selectColumns(Table table) {
        List<String> selected = new ArrayList<>();
        for (ColumnAnalysis analysis : analyze(table)) {
            if (analysis.autoSelected()) {
                selected.add(analysis.columnId());
            }
        }
        return selected;
    }

    private List<Cell> sample(List<Cell> cells) {
        List<Cell> sample = new ArrayList<>(Math.min(sampleSize, cells.size()));
        for (Cell cell : cells) {
            if (!cell.text().isBlank()) {
                sample.add(cell);
                if (sample.size() == sampleSize) {
                    break;
                }
            }
        }
        return sample;
    }

    private ColumnAnalysis analyzeColumn(String column, List<Cell> sample) {
        if (sample.isEmpty()) {
            return new ColumnAnalysis(column, ColumnType.EMPTY, 0, Optional.empty(), 0.0, false);
        }
        Map<Decision, Integer> decisions = new EnumMap<>(Decision.class);
        Map<String, Integer> languages = new LinkedHashMap<>();
        double confidenceSum = 0.0;
        int detected = 0;
        for (Cell cell : sample) {
            ClassificationResult result = classifier.classify(cell);
            decisions.merge(result.decision(), 1, Integer::sum);
            if (result.decision() == Decision.TRANSLATE || result.decision() == Decision.LOW_CONFIDENCE_FALLBACK) {
                confidenceSum += result.confidence();
                detected++;
            }
            if (result.decision() == Decision.TRANSLATE) {
                languages.merge(result.languageCode(), 1, Integer::sum);
            }
        }
        ColumnType type = inferType(decisions, sample.size());
        Optional<String> dominant = languages.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey);
        double averageConfidence = detected == 0 ? 0.0 : confidenceSum / detected;
        return new ColumnAnalysis(column, type, sample.size(), dominant, averageConfidence, type.needsTranslation());
    }

    private ColumnType inferType(Map<Decision, Integer> decisions, int total) {
        int foreign = decisions.getOrDefault(Decision.TRANSLATE, 0);
        if (foreign > 0) {
            return share(foreign, total) >= DOMINANT_SHARE ? ColumnType.FOREIGN_TEXT : ColumnType.MIXED;
        }
        int numeric = decisions.getOrDefault(Decision.SKIP_NUMERIC, 0);
        int dates = decisions.getOrDefault(Decision.SKIP_DATE, 0);
        if (share(numeric, total) >= DOMINANT_SHARE) {
            return ColumnType.NUMERIC;
        }
        if (share(dates, total) >= DOMINANT_SHARE) {
            return ColumnType.DATE;
        }
        return ColumnType.ENGLISH;
    }

    private static double share(int count, int total) {
        return (double) count / total;
    }
}
