package ai.tabular.translator.engine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the engine for each unit: the selected engine when it supports the language pair,
 * otherwise the first alternate engine that does when capability fallback is enabled.
 */
public class EngineRouter {

    private final List<EngineAdapter> engines;
    private final boolean fallbackEnabled;

    /**
     * @param engines engines in preference order; the first one is the engine selected for the run
     */
    public EngineRouter(List<EngineAdapter> engines, boolean fallbackEnabled) {
        Objects.requireNonNull(engines, "engines");
        if (engines.isEmpty()) {
            throw new IllegalArgumentException("at least one engine is required");
        }
        this.engines = List.copyOf(engines);
        this.fallbackEnabled = fallbackEnabled;
    }

    public EngineAdapter selected() {
        return engines.get(0);
    }

    public List<EngineAdapter> engines() {
        return engines;
    }

    public Optional<EngineAdapter> route(TranslationUnit unit) {
        List<EngineAdapter> candidates = fallbackEnabled ? engines : List.of(selected());
        for (EngineAdapter engine : candidates) {
            if (engine.supports(unit.sourceLanguage()) && engine.supports(unit.targetLanguage())) {
                return Optional.of(engine);
            }
        }
        return Optional.empty();
    }
}
