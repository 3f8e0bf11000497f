package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.EngineAdapter;
import ai.tabular.translator.engine.EngineCapability;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationResult;
import ai.tabular.translator.engine.TranslationUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Engine stand-in that records the batches it receives.
 */
class FakeEngine implements EngineAdapter {

    final List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
    final List<String> threads = Collections.synchronizedList(new ArrayList<>());
    private final EngineCapability capability;
    private final Function<List<TranslationUnit>, List<TranslationResult>> behaviour;

    FakeEngine(EngineId id, Set<String> languages, int maxBatch,
               Function<List<TranslationUnit>, List<TranslationResult>> behaviour) {
        this.capability = new EngineCapability(id, languages, maxBatch);
        this.behaviour = behaviour;
    }

    static FakeEngine translating(EngineId id, Set<String> languages, int maxBatch) {
        return new FakeEngine(id, languages, maxBatch, units -> {
            List<TranslationResult> results = new ArrayList<>();
            for (TranslationUnit unit : units) {
                results.add(TranslationResult.translated(unit.cell(), "EN(" + unit.sourceText() + ")"));
            }
            return results;
        });
    }

    @Override
    public EngineId id() {
        return capability.engineId();
    }

    @Override
    public boolean supports(String languageCode) {
        return capability.supports(languageCode);
    }

    @Override
    public int maxBatchSize() {
        return capability.maxBatchSize();
    }

    @Override
    public EngineCapability capability() {
        return capability;
    }

    @Override
    public List<TranslationResult> translateBatch(List<TranslationUnit> units) {
        batchSizes.add(units.size());
        threads.add(Thread.currentThread().getName());
        return behaviour.apply(units);
    }
}
