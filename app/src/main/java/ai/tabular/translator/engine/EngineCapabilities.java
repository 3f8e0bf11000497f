package ai.tabular.translator.engine;

import ai.tabular.translator.language.LanguageCatalog;
import ai.tabular.translator.language.LanguageInfo;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only capability table loaded once at startup.
 */
public final class EngineCapabilities {

    static final int BROAD_COVERAGE_MAX_BATCH = 16;
    static final int LIGHTWEIGHT_MAX_BATCH = 32;

    private final Map<EngineId, EngineCapability> capabilities;

    public EngineCapabilities(Map<EngineId, EngineCapability> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities");
        EnumMap<EngineId, EngineCapability> copy = new EnumMap<>(EngineId.class);
        copy.putAll(capabilities);
        this.capabilities = Map.copyOf(copy);
    }

    public static EngineCapabilities standard(LanguageCatalog catalog) {
        Set<String> all = catalog.languages().stream()
                .map(LanguageInfo::code)
                .collect(Collectors.toUnmodifiableSet());
        Set<String> packs = catalog.languages().stream()
                .filter(LanguageInfo::lightweightPack)
                .map(LanguageInfo::code)
                .collect(Collectors.toUnmodifiableSet());
        Map<EngineId, EngineCapability> table = new EnumMap<>(EngineId.class);
        table.put(EngineId.ENGINE_A, new EngineCapability(EngineId.ENGINE_A, all, BROAD_COVERAGE_MAX_BATCH));
        table.put(EngineId.ENGINE_B, new EngineCapability(EngineId.ENGINE_B, packs, LIGHTWEIGHT_MAX_BATCH));
        return new EngineCapabilities(table);
    }

    public EngineCapability get(EngineId engineId) {
        EngineCapability capability = capabilities.get(engineId);
        if (capability == null) {
            throw new IllegalArgumentException("No capability registered for " + engineId);
        }
        return capability;
    }
}
