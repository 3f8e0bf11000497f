package ai.tabular.translator.engine;

import ai.tabular.translator.engine.TranslationUnit.LanguagePair;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared batch handling: code mapping, per language pair dispatch and per-unit failure
 * isolation. Subclasses only translate internal codes into their own vocabulary.
 */
public abstract class AbstractEngineAdapter implements EngineAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractEngineAdapter.class);

    private final EngineCapability capability;
    private final TranslationBackend backend;

    protected AbstractEngineAdapter(EngineCapability capability, TranslationBackend backend) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    /**
     * Maps an internal language code into the code the backend expects.
     */
    protected abstract String toEngineCode(String internalCode);

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
        if (units == null || units.isEmpty()) {
            return List.of();
        }
        Map<LanguagePair, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < units.size(); i++) {
            groups.computeIfAbsent(units.get(i).languagePair(), key -> new ArrayList<>()).add(i);
        }
        TranslationResult[] results = new TranslationResult[units.size()];
        for (Map.Entry<LanguagePair, List<Integer>> group : groups.entrySet()) {
            List<TranslationUnit> members = new ArrayList<>(group.getValue().size());
            for (int index : group.getValue()) {
                members.add(units.get(index));
            }
            List<TranslationResult> groupResults = translateGroup(group.getKey(), members);
            for (int i = 0; i < groupResults.size(); i++) {
                results[group.getValue().get(i)] = groupResults.get(i);
            }
        }
        return List.of(results);
    }

    private List<TranslationResult> translateGroup(LanguagePair pair, List<TranslationUnit> units) {
        List<TranslationResult> unsupported = rejectUnsupported(pair, units);
        if (unsupported != null) {
            return unsupported;
        }
        String source = toEngineCode(pair.source());
        String target = toEngineCode(pair.target());
        List<String> texts = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            texts.add(unit.sourceText());
        }
        try {
            List<String> translated = backend.translateAll(texts, source, target);
            if (translated == null || translated.size() != units.size()) {
                throw new BackendInferenceException("Backend returned a result count different from the batch size", null);
            }
            List<TranslationResult> results = new ArrayList<>(units.size());
            for (int i = 0; i < units.size(); i++) {
                results.add(toResult(units.get(i), translated.get(i)));
            }
            return results;
        } catch (BackendResourceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            if (units.size() == 1) {
                return List.of(failure(units.get(0), ex));
            }
            LOGGER.warn("{} batch of {} units ({}) failed: {}; retrying unit by unit",
                    id(), units.size(), pair, ex.getMessage());
            return translateIndividually(units, source, target);
        }
    }

    private List<TranslationResult> translateIndividually(List<TranslationUnit> units, String source, String target) {
        List<TranslationResult> results = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            try {
                results.add(toResult(unit, backend.translate(unit.sourceText(), source, target)));
            } catch (BackendResourceException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                results.add(failure(unit, ex));
            }
        }
        return results;
    }

    private List<TranslationResult> rejectUnsupported(LanguagePair pair, List<TranslationUnit> units) {
        String missing = !supports(pair.source()) ? pair.source() : !supports(pair.target()) ? pair.target() : null;
        if (missing == null) {
            return null;
        }
        List<TranslationResult> results = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            results.add(TranslationResult.unsupported(unit.cell(), missing));
        }
        return results;
    }

    private TranslationResult toResult(TranslationUnit unit, String translated) {
        if (translated == null || translated.isBlank()) {
            return TranslationResult.failed(unit.cell(), id() + " returned an empty translation");
        }
        return TranslationResult.translated(unit.cell(), translated);
    }

    private TranslationResult failure(TranslationUnit unit, RuntimeException ex) {
        LOGGER.warn("{} failed to translate {}: {}", id(), unit.cell(), ex.getMessage());
        return TranslationResult.failed(unit.cell(), ex.getMessage());
    }
}
