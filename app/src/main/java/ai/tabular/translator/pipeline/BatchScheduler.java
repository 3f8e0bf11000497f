package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.EngineCapability;
import ai.tabular.translator.engine.TranslationUnit;
import ai.tabular.translator.engine.TranslationUnit.LanguagePair;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups units bound for one engine into batches of one language pair each, capped at the
 * smaller of the engine limit and the configured batch size. Groups appear in order of their
 * first unit and members keep cell read order.
 */
public class BatchScheduler {

    public static final int DEFAULT_BATCH_SIZE = 16;

    private final int batchSize;

    public BatchScheduler(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    public int batchSize() {
        return batchSize;
    }

    public List<Batch> schedule(List<TranslationUnit> units, EngineCapability capability) {
        if (units == null || units.isEmpty()) {
            return List.of();
        }
        int limit = capability.effectiveBatchSize(batchSize);
        Map<LanguagePair, List<TranslationUnit>> groups = new LinkedHashMap<>();
        for (TranslationUnit unit : units) {
            groups.computeIfAbsent(unit.languagePair(), key -> new ArrayList<>()).add(unit);
        }
        List<Batch> batches = new ArrayList<>();
        for (Map.Entry<LanguagePair, List<TranslationUnit>> group : groups.entrySet()) {
            List<TranslationUnit> members = group.getValue();
            for (int start = 0; start < members.size(); start += limit) {
                int end = Math.min(members.size(), start + limit);
                batches.add(new Batch(capability.engineId(), group.getKey(), members.subList(start, end)));
            }
        }
        return batches;
    }
}
