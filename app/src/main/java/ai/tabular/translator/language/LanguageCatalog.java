package ai.tabular.translator.language;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed code table shared by the classifier and both engines. Internal codes follow the
 * {@code xxx_Script} convention of the broad-coverage engine; the ISO 639-1 column is the
 * vocabulary of the lightweight engine.
 */
public final class LanguageCatalog {

    public static final String UNKNOWN = "unknown";
    public static final String ENGLISH = "eng_Latn";

    private static final LanguageCatalog DEFAULT = new LanguageCatalog(List.of(
            new LanguageInfo("eng_Latn", "en", "English", "Germanic", true),
            new LanguageInfo("rus_Cyrl", "ru", "Russian", "Slavic", true),
            new LanguageInfo("ukr_Cyrl", "uk", "Ukrainian", "Slavic", true),
            new LanguageInfo("bel_Cyrl", "be", "Belarusian", "Slavic", false),
            new LanguageInfo("bul_Cyrl", "bg", "Bulgarian", "Slavic", false),
            new LanguageInfo("srp_Cyrl", "sr", "Serbian", "Slavic", false),
            new LanguageInfo("hrv_Latn", "hr", "Croatian", "Slavic", false),
            new LanguageInfo("pol_Latn", "pl", "Polish", "Slavic", true),
            new LanguageInfo("ces_Latn", "cs", "Czech", "Slavic", true),
            new LanguageInfo("slk_Latn", "sk", "Slovak", "Slavic", false),
            new LanguageInfo("deu_Latn", "de", "German", "Germanic", true),
            new LanguageInfo("nld_Latn", "nl", "Dutch", "Germanic", true),
            new LanguageInfo("swe_Latn", "sv", "Swedish", "Germanic", true),
            new LanguageInfo("dan_Latn", "da", "Danish", "Germanic", false),
            new LanguageInfo("nob_Latn", "nb", "Norwegian Bokmal", "Germanic", false),
            new LanguageInfo("fra_Latn", "fr", "French", "Romance", true),
            new LanguageInfo("spa_Latn", "es", "Spanish", "Romance", true),
            new LanguageInfo("por_Latn", "pt", "Portuguese", "Romance", true),
            new LanguageInfo("ita_Latn", "it", "Italian", "Romance", true),
            new LanguageInfo("ron_Latn", "ro", "Romanian", "Romance", false),
            new LanguageInfo("cat_Latn", "ca", "Catalan", "Romance", false),
            new LanguageInfo("ell_Grek", "el", "Greek", "Hellenic", true),
            new LanguageInfo("fin_Latn", "fi", "Finnish", "Uralic", true),
            new LanguageInfo("est_Latn", "et", "Estonian", "Uralic", false),
            new LanguageInfo("hun_Latn", "hu", "Hungarian", "Uralic", true),
            new LanguageInfo("lit_Latn", "lt", "Lithuanian", "Baltic", false),
            new LanguageInfo("lvs_Latn", "lv", "Latvian", "Baltic", false),
            new LanguageInfo("tur_Latn", "tr", "Turkish", "Turkic", true),
            new LanguageInfo("azj_Latn", "az", "Azerbaijani", "Turkic", false),
            new LanguageInfo("kaz_Cyrl", "kk", "Kazakh", "Turkic", false),
            new LanguageInfo("arb_Arab", "ar", "Arabic", "Semitic", true),
            new LanguageInfo("heb_Hebr", "he", "Hebrew", "Semitic", true),
            new LanguageInfo("pes_Arab", "fa", "Persian", "Iranian", true),
            new LanguageInfo("hin_Deva", "hi", "Hindi", "Indo-Aryan", true),
            new LanguageInfo("ben_Beng", "bn", "Bengali", "Indo-Aryan", false),
            new LanguageInfo("urd_Arab", "ur", "Urdu", "Indo-Aryan", false),
            new LanguageInfo("zho_Hans", "zh", "Chinese (Simplified)", "Sino-Tibetan", true),
            new LanguageInfo("jpn_Jpan", "ja", "Japanese", "Japonic", true),
            new LanguageInfo("kor_Hang", "ko", "Korean", "Koreanic", true),
            new LanguageInfo("vie_Latn", "vi", "Vietnamese", "Austroasiatic", true),
            new LanguageInfo("tha_Thai", "th", "Thai", "Kra-Dai", false),
            new LanguageInfo("ind_Latn", "id", "Indonesian", "Austronesian", false),
            new LanguageInfo("zsm_Latn", "ms", "Malay", "Austronesian", false),
            new LanguageInfo("kat_Geor", "ka", "Georgian", "Kartvelian", false),
            new LanguageInfo("hye_Armn", "hy", "Armenian", "Armenian", false),
            new LanguageInfo("swh_Latn", "sw", "Swahili", "Niger-Congo", false)
    ));

    private final Map<String, LanguageInfo> byCode = new LinkedHashMap<>();
    private final Map<String, LanguageInfo> byIsoCode = new LinkedHashMap<>();

    public LanguageCatalog(Collection<LanguageInfo> languages) {
        for (LanguageInfo language : languages) {
            byCode.put(language.code().toLowerCase(Locale.ROOT), language);
            byIsoCode.put(language.isoCode().toLowerCase(Locale.ROOT), language);
        }
    }

    public static LanguageCatalog defaultCatalog() {
        return DEFAULT;
    }

    public Optional<LanguageInfo> byCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public Optional<LanguageInfo> byIsoCode(String isoCode) {
        if (isoCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byIsoCode.get(isoCode.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Accepts either vocabulary and returns the table entry.
     */
    public Optional<LanguageInfo> resolve(String anyCode) {
        return byCode(anyCode).or(() -> byIsoCode(anyCode));
    }

    /**
     * Normalizes a user supplied code into the internal vocabulary.
     *
     * @throws IllegalArgumentException when the code is not in the table
     */
    public String normalize(String anyCode) {
        return resolve(anyCode)
                .map(LanguageInfo::code)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language code: " + anyCode));
    }

    public String displayName(String code) {
        return byCode(code).map(LanguageInfo::name).orElse(code);
    }

    public List<LanguageInfo> languages() {
        return List.copyOf(byCode.values());
    }
}
