package ai.tabular.translator.language;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cheap predicates consulted before the language classifier. Rules run in a fixed order
 * and the first match wins: empty, numeric, date, already English.
 */
public class SkipRuleEvaluator {

    private static final Pattern NUMERIC = Pattern.compile(
            "[+-]?[$€£¥₽₹]?\\s?"
                    + "(?:(?:\\d{1,3}(?:[,.' \\u00A0]\\d{3})+|\\d+)(?:[.,]\\d+)?|[.,]\\d+)"
                    + "(?:[eE][+-]?\\d+)?"
                    + "\\s?[%€$£]?");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+(?:'[A-Za-z]+)?");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-MM-dd"),
            strict("uuuu/MM/dd"),
            strict("dd/MM/uuuu"),
            strict("MM/dd/uuuu"),
            strict("M/d/uu"),
            strict("d/M/uu"),
            strict("dd.MM.uuuu"),
            strict("d.M.uuuu"),
            strict("dd-MM-uuuu"),
            strict("d MMM uuuu"),
            strict("d MMMM uuuu"),
            strict("MMM d, uuuu"),
            strict("MMMM d, uuuu"));
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm"),
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("dd/MM/uuuu HH:mm"),
            strict("dd.MM.uuuu HH:mm"));

    private static final Set<String> ENGLISH_LEXICON = Set.of(
            "a", "about", "after", "all", "also", "am", "an", "and", "any", "are", "as", "at",
            "bad", "be", "because", "been", "before", "best", "but", "by", "can", "could",
            "customer", "day", "delivery", "did", "do", "does", "done", "excellent", "fast",
            "fine", "for", "from", "get", "good", "great", "had", "has", "have", "he", "hello",
            "her", "here", "hi", "his", "how", "i", "if", "in", "into", "is", "it", "item",
            "its", "just", "like", "more", "my", "new", "no", "not", "now", "of", "ok", "okay",
            "on", "one", "only", "or", "order", "other", "our", "out", "price", "product",
            "quality", "received", "service", "she", "should", "so", "some", "than", "thank",
            "thanks", "that", "the", "their", "them", "then", "there", "these", "they", "this",
            "to", "too", "two", "up", "us", "very", "was", "we", "well", "were", "what", "when",
            "which", "who", "will", "with", "would", "yes", "you", "your");
    // Lexicon words that are also everyday words in other Latin-script languages.
    private static final Set<String> SHARED_WORDS = Set.of(
            "a", "also", "am", "an", "as", "at", "bad", "be", "best", "by", "do", "fast", "he",
            "her", "hi", "i", "if", "in", "is", "it", "my", "no", "of", "on", "or", "so", "to",
            "up", "us", "was", "we", "will");
    private static final int SHORT_CELL_WORDS = 3;
    private static final double ENGLISH_WORD_RATIO = 0.5;

    public Optional<Decision> evaluate(String text, SkipRules rules) {
        String value = text == null ? "" : text.strip();
        if (value.isEmpty()) {
            return rules.skipEmpty() ? Optional.of(Decision.SKIP_EMPTY) : Optional.empty();
        }
        if (rules.skipNumeric() && isNumeric(value)) {
            return Optional.of(Decision.SKIP_NUMERIC);
        }
        if (rules.skipDates() && isDate(value)) {
            return Optional.of(Decision.SKIP_DATE);
        }
        if (rules.skipEnglish() && looksEnglish(value)) {
            return Optional.of(Decision.SKIP_ENGLISH);
        }
        return Optional.empty();
    }

    boolean isNumeric(String value) {
        return HAS_DIGIT.matcher(value).find() && NUMERIC.matcher(value).matches();
    }

    boolean isDate(String value) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                LocalDate.parse(value, format);
                return true;
            } catch (DateTimeParseException ignored) {
                // next grammar
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                LocalDateTime.parse(value, format);
                return true;
            } catch (DateTimeParseException ignored) {
                // next grammar
            }
        }
        try {
            OffsetDateTime.parse(value);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    boolean looksEnglish(String value) {
        boolean hasLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch > 0x7F) {
                return false;
            }
            if (Character.isLetter(ch)) {
                hasLetter = true;
            }
        }
        if (!hasLetter) {
            return false;
        }
        var matcher = WORD.matcher(value);
        int words = 0;
        int hits = 0;
        int distinctiveHits = 0;
        while (matcher.find()) {
            words++;
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (ENGLISH_LEXICON.contains(word)) {
                hits++;
                if (!SHARED_WORDS.contains(word)) {
                    distinctiveHits++;
                }
            }
        }
        if (words == 0 || distinctiveHits == 0) {
            return false;
        }
        if (words <= SHORT_CELL_WORDS) {
            return hits == words;
        }
        return (double) hits / words > ENGLISH_WORD_RATIO;
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
