package ai.tabular.translator.language;

import java.util.Objects;

/**
 * One row of the fixed language code table.
 *
 * @param code internal code, e.g. {@code rus_Cyrl}
 * @param isoCode ISO 639-1 code, e.g. {@code ru}
 * @param name English display name
 * @param family language family used for listings
 * @param lightweightPack whether the lightweight engine ships a model for this language
 */
public record LanguageInfo(String code, String isoCode, String name, String family, boolean lightweightPack) {

    public LanguageInfo {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(isoCode, "isoCode");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(family, "family");
    }
}
