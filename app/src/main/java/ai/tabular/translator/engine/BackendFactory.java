package ai.tabular.translator.engine;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provides backend instances based on the desired execution mode.
 */
public class BackendFactory {

    private final Map<EngineId, TranslationBackend> productionBackends;
    private final TranslationBackend dryRunBackend;
    private final TranslationBackend mockBackend;

    public BackendFactory(Map<EngineId, TranslationBackend> productionBackends,
                          TranslationBackend dryRunBackend,
                          TranslationBackend mockBackend) {
        Objects.requireNonNull(productionBackends, "productionBackends");
        this.productionBackends = new EnumMap<>(EngineId.class);
        this.productionBackends.putAll(productionBackends);
        this.dryRunBackend = Objects.requireNonNull(dryRunBackend, "dryRunBackend");
        this.mockBackend = Objects.requireNonNull(mockBackend, "mockBackend");
    }

    public TranslationBackend select(TranslationMode mode, EngineId engineId) {
        return switch (mode) {
            case PRODUCTION -> {
                TranslationBackend backend = productionBackends.get(engineId);
                if (backend == null) {
                    throw new IllegalStateException("No production backend configured for " + engineId);
                }
                yield backend;
            }
            case DRY_RUN -> dryRunBackend;
            case MOCK -> mockBackend;
        };
    }
}
