package ai.tabular.translator.engine;

import java.util.List;

/**
 * Uniform capability-checked translation contract shared by both engines.
 */
public interface EngineAdapter {

    EngineId id();

    boolean supports(String languageCode);

    int maxBatchSize();

    EngineCapability capability();

    /**
     * Translates a batch and returns one result per unit, in unit order. Failures of
     * individual units are reported as failed results.
     *
     * @throws BackendResourceException when the backend ran out of resources for the batch
     */
    List<TranslationResult> translateBatch(List<TranslationUnit> units);
}
