package ai.tabular.translator.engine;

/**
 * Engine A: broad language coverage, default engine. Internal codes are its native
 * vocabulary.
 */
public class BroadCoverageEngine extends AbstractEngineAdapter {

    public BroadCoverageEngine(EngineCapability capability, TranslationBackend backend) {
        super(capability, backend);
        if (capability.engineId() != EngineId.ENGINE_A) {
            throw new IllegalArgumentException("capability belongs to " + capability.engineId());
        }
    }

    @Override
    protected String toEngineCode(String internalCode) {
        return internalCode;
    }
}
