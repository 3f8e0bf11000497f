package ai.tabular.translator.language;

/**
 * Run-level switches for the skip rules.
 */
public record SkipRules(boolean skipEmpty, boolean skipNumeric, boolean skipDates, boolean skipEnglish) {

    public static SkipRules all() {
        return new SkipRules(true, true, true, true);
    }

    public static SkipRules none() {
        return new SkipRules(false, false, false, false);
    }
}
