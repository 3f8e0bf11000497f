package ai.tabular.translator.language;

import ai.tabular.translator.table.Cell;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides per cell whether translation is needed and from which language. Skip rules are
 * evaluated first so that the identification model never sees empty, numeric or date text.
 */
public class LanguageClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageClassifier.class);

    private final LanguageIdentifier identifier;
    private final SkipRuleEvaluator skipRuleEvaluator;
    private final SkipRules skipRules;
    private final ClassifierSettings settings;

    public LanguageClassifier(LanguageIdentifier identifier,
                              SkipRuleEvaluator skipRuleEvaluator,
                              SkipRules skipRules,
                              ClassifierSettings settings) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.skipRuleEvaluator = Objects.requireNonNull(skipRuleEvaluator, "skipRuleEvaluator");
        this.skipRules = Objects.requireNonNull(skipRules, "skipRules");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ClassificationResult classify(Cell cell) {
        Objects.requireNonNull(cell, "cell");
        if (cell.isMalformed()) {
            LOGGER.warn("Cell {} contains corrupted characters; marking as malformed", cell.ref());
            return ClassificationResult.skipped(cell.ref(), Decision.MALFORMED_CELL);
        }
        Optional<Decision> skip = skipRuleEvaluator.evaluate(cell.text(), skipRules);
        if (skip.isPresent()) {
            return ClassificationResult.skipped(cell.ref(), skip.get());
        }
        if (settings.forcedLanguage().isPresent()) {
            return decide(cell, new Detection(settings.forcedLanguage().get(), 1.0));
        }
        return decide(cell, identifier.detect(cell.text().strip()));
    }

    private ClassificationResult decide(Cell cell, Detection detection) {
        if (detection.isUnknown() || detection.confidence() < settings.confidenceThreshold()) {
            LOGGER.debug("Low confidence {} ({}) for {}; using fallback {}",
                    detection.languageCode(), detection.confidence(), cell.ref(), settings.fallbackLanguage());
            return new ClassificationResult(cell.ref(), settings.fallbackLanguage(), detection.confidence(),
                    Decision.LOW_CONFIDENCE_FALLBACK);
        }
        if (detection.languageCode().equals(settings.targetLanguage())) {
            return new ClassificationResult(cell.ref(), detection.languageCode(), detection.confidence(),
                    Decision.SKIP_ENGLISH);
        }
        return new ClassificationResult(cell.ref(), detection.languageCode(), detection.confidence(),
                Decision.TRANSLATE);
    }
}
