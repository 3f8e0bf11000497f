package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationUnit;
import ai.tabular.translator.engine.TranslationUnit.LanguagePair;
import java.util.List;
import java.util.Objects;

/**
 * Units sharing one engine and one language pair, dispatched in a single backend call.
 */
public record Batch(EngineId engineId, LanguagePair languagePair, List<TranslationUnit> units) {

    public Batch {
        Objects.requireNonNull(engineId, "engineId");
        Objects.requireNonNull(languagePair, "languagePair");
        units = List.copyOf(Objects.requireNonNull(units, "units"));
        if (units.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one unit");
        }
    }

    public int size() {
        return units.size();
    }
}
