package ai.tabular.translator.pipeline;

import ai.tabular.translator.engine.BackendResourceException;
import ai.tabular.translator.engine.EngineAdapter;
import ai.tabular.translator.engine.TranslationResult;
import ai.tabular.translator.engine.TranslationUnit;
import ai.tabular.translator.table.CellRef;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits one batch to an engine. A batch that fails for lack of resources is retried once,
 * split into halves; units still failing after the retry are marked failed.
 */
class BatchDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchDispatcher.class);

    List<TranslationResult> dispatch(EngineAdapter engine, Batch batch) {
        try {
            return align(batch.units(), engine.translateBatch(batch.units()), "unexpected batch result");
        } catch (BackendResourceException ex) {
            int half = Math.max(1, batch.size() / 2);
            LOGGER.warn("{} ran out of resources on a batch of {} ({}); retrying in batches of {}",
                    engine.id(), batch.size(), batch.languagePair(), half);
            List<TranslationResult> results = new ArrayList<>(batch.size());
            for (int start = 0; start < batch.size(); start += half) {
                List<TranslationUnit> chunk = batch.units().subList(start, Math.min(batch.size(), start + half));
                results.addAll(retry(engine, chunk));
            }
            return results;
        } catch (RuntimeException ex) {
            LOGGER.error("{} batch {} failed: {}", engine.id(), batch.languagePair(), ex.getMessage(), ex);
            return failAll(batch.units(), ex.getMessage());
        }
    }

    private List<TranslationResult> retry(EngineAdapter engine, List<TranslationUnit> chunk) {
        try {
            return align(chunk, engine.translateBatch(chunk), "unexpected batch result");
        } catch (BackendResourceException ex) {
            LOGGER.error("{} still out of resources for {} units after retry: {}", engine.id(), chunk.size(), ex.getMessage());
            return failAll(chunk, "resources exhausted: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("{} retry failed: {}", engine.id(), ex.getMessage(), ex);
            return failAll(chunk, ex.getMessage());
        }
    }

    /**
     * Re-keys results by cell so that a misbehaving engine can never shift a translation
     * into another cell.
     */
    private List<TranslationResult> align(List<TranslationUnit> units, List<TranslationResult> results, String reason) {
        Map<CellRef, TranslationResult> byCell = new HashMap<>();
        if (results != null) {
            for (TranslationResult result : results) {
                if (result != null) {
                    byCell.put(result.cell(), result);
                }
            }
        }
        List<TranslationResult> aligned = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            TranslationResult result = byCell.get(unit.cell());
            aligned.add(result != null ? result : TranslationResult.failed(unit.cell(), reason));
        }
        return aligned;
    }

    private List<TranslationResult> failAll(List<TranslationUnit> units, String detail) {
        List<TranslationResult> failed = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            failed.add(TranslationResult.failed(unit.cell(), detail));
        }
        return failed;
    }
}
