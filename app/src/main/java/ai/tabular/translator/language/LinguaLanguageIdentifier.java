package ai.tabular.translator.language;

import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline language identification backed by Lingua, restricted to the languages of the
 * code table. The detector is built once and shared for the lifetime of the process.
 *
 * <p>The reported confidence is Lingua's probability for the best language scaled by the
 * amount of evidence in the text: a cell needs {@value #FULL_EVIDENCE_LETTERS} letters
 * (ideographs and syllables count {@value #DENSE_SCRIPT_WEIGHT} each) before the
 * probability is taken at face value. A single short word scores below the default
 * threshold whatever language the n-gram models lean to.
 */
public class LinguaLanguageIdentifier implements LanguageIdentifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinguaLanguageIdentifier.class);
    static final int FULL_EVIDENCE_LETTERS = 10;
    static final int DENSE_SCRIPT_WEIGHT = 3;

    private final LanguageCatalog catalog;
    private final LanguageDetector detector;

    public LinguaLanguageIdentifier(LanguageCatalog catalog, boolean preloadModels) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.detector = buildDetector(catalog, preloadModels);
    }

    LinguaLanguageIdentifier(LanguageCatalog catalog, LanguageDetector detector) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    @Override
    public Detection detect(String text) {
        if (text == null || text.isBlank()) {
            return Detection.unknown();
        }
        Map<Language, Double> confidences = detector.computeLanguageConfidenceValues(text);
        Optional<Map.Entry<Language, Double>> best = confidences.entrySet().stream()
                .max(Map.Entry.comparingByValue());
        if (best.isEmpty() || best.get().getKey() == Language.UNKNOWN) {
            return Detection.unknown();
        }
        Language language = best.get().getKey();
        double total = confidences.values().stream().mapToDouble(Double::doubleValue).sum();
        double probability = total > 0.0 ? best.get().getValue() / total : 0.0;
        double confidence = Math.max(0.0, Math.min(1.0, probability * evidence(text)));
        return toCatalogCode(language)
                .map(code -> new Detection(code, confidence))
                .orElseGet(Detection::unknown);
    }

    static double evidence(String text) {
        int weight = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (Character.isLetter(codePoint)) {
                weight += isDenseScript(codePoint) ? DENSE_SCRIPT_WEIGHT : 1;
            }
            i += Character.charCount(codePoint);
        }
        return Math.min(1.0, (double) weight / FULL_EVIDENCE_LETTERS);
    }

    private static boolean isDenseScript(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HANGUL;
    }

    private Optional<String> toCatalogCode(Language language) {
        return catalog.byIsoCode(language.getIsoCode639_1().name().toLowerCase(Locale.ROOT))
                .map(LanguageInfo::code);
    }

    private static LanguageDetector buildDetector(LanguageCatalog catalog, boolean preloadModels) {
        List<Language> languages = new ArrayList<>();
        for (Language language : Language.values()) {
            if (language == Language.UNKNOWN) {
                continue;
            }
            String iso = language.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
            if (catalog.byIsoCode(iso).isPresent()) {
                languages.add(language);
            }
        }
        if (languages.size() < 2) {
            throw new IllegalStateException("Language catalog must cover at least two detectable languages");
        }
        LOGGER.info("Building language detector for {} languages (preload={})", languages.size(), preloadModels);
        LanguageDetectorBuilder builder = LanguageDetectorBuilder.fromLanguages(languages.toArray(new Language[0]));
        if (preloadModels) {
            builder = builder.withPreloadedLanguageModels();
        }
        return builder.build();
    }
}
