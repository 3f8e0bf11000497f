package ai.tabular.translator.engine;

import ai.tabular.translator.language.LanguageCatalog;
import ai.tabular.translator.language.LanguageInfo;
import java.util.Objects;

/**
 * Engine B: small per-pair models addressed by ISO 639-1 codes.
 */
public class LightweightEngine extends AbstractEngineAdapter {

    private final LanguageCatalog catalog;

    public LightweightEngine(EngineCapability capability, TranslationBackend backend, LanguageCatalog catalog) {
        super(capability, backend);
        if (capability.engineId() != EngineId.ENGINE_B) {
            throw new IllegalArgumentException("capability belongs to " + capability.engineId());
        }
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    protected String toEngineCode(String internalCode) {
        return catalog.byCode(internalCode)
                .map(LanguageInfo::isoCode)
                .orElseThrow(() -> new IllegalArgumentException("No ISO code for " + internalCode));
    }
}
