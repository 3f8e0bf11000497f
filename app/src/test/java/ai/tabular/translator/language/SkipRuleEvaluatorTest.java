package ai.tabular.translator.language;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SkipRuleEvaluatorTest {

    private final SkipRuleEvaluator evaluator = new SkipRuleEvaluator();

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t\n"})
    void blankTextIsSkippedAsEmpty(String text) {
        assertThat(evaluator.evaluate(text, SkipRules.all())).contains(Decision.SKIP_EMPTY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"123", "-42", "3.14", "1,234.56", "1.234,56", "12 500", "$99", "45%", "1e-5", "€ 20"})
    void numbersInCommonNotationsAreSkipped(String text) {
        assertThat(evaluator.evaluate(text, SkipRules.all())).contains(Decision.SKIP_NUMERIC);
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-01", "31/12/2023", "12/31/2023", "01.02.2024", "2024/03/15",
            "15-03-2024", "5 Mar 2024", "March 5, 2024", "2024-01-01T10:15:30", "2024-01-01 10:15",
            "1/1/24", "12/31/23", "31/12/23"})
    void datesInSupportedGrammarsAreSkipped(String text) {
        assertThat(evaluator.evaluate(text, SkipRules.all())).contains(Decision.SKIP_DATE);
    }

    @Test
    void impossibleCalendarDateIsNotADate() {
        assertThat(evaluator.isDate("2024-02-30")).isFalse();
    }

    @Test
    void englishTextIsSkipped() {
        assertThat(evaluator.evaluate("Hello", SkipRules.all())).contains(Decision.SKIP_ENGLISH);
        assertThat(evaluator.evaluate("Thank you for the fast delivery", SkipRules.all())).contains(Decision.SKIP_ENGLISH);
    }

    @Test
    void foreignTextPassesThrough() {
        assertThat(evaluator.evaluate("Отличный продукт!", SkipRules.all())).isEmpty();
        assertThat(evaluator.evaluate("Das Produkt ist ausgezeichnet", SkipRules.all())).isEmpty();
        assertThat(evaluator.evaluate("Producto excelente, llegó rápido", SkipRules.all())).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"No funciona", "No gracias", "in Ordnung", "Producto no", "Es ist so", "Das war es also"})
    void foreignCellsSharingShortWordsWithEnglishAreNotSkipped(String text) {
        assertThat(evaluator.evaluate(text, SkipRules.all())).isEmpty();
    }

    @Test
    void shortEnglishCellsNeedEveryWordKnown() {
        assertThat(evaluator.looksEnglish("Thank you")).isTrue();
        assertThat(evaluator.looksEnglish("ok ok")).isTrue();
        assertThat(evaluator.looksEnglish("no in is")).isFalse();
        assertThat(evaluator.looksEnglish("Thank Mama")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"e5", "E3", "e-2"})
    void exponentWithoutMantissaIsNotNumeric(String text) {
        assertThat(evaluator.isNumeric(text)).isFalse();
    }

    @Test
    void textMixingDigitsAndWordsIsNotNumeric() {
        assertThat(evaluator.isNumeric("12 штук")).isFalse();
        assertThat(evaluator.isNumeric("Order 66")).isFalse();
        assertThat(evaluator.isNumeric("-")).isFalse();
    }

    @Test
    void disabledRulesAreNotApplied() {
        SkipRules noNumbers = new SkipRules(true, false, true, true);

        assertThat(evaluator.evaluate("123", noNumbers)).isEmpty();
        assertThat(evaluator.evaluate("", SkipRules.none())).isEmpty();
        assertThat(evaluator.evaluate("Hello", new SkipRules(true, true, true, false))).isEmpty();
    }

    @Test
    void firstMatchingRuleWins() {
        assertThat(evaluator.evaluate("2024", SkipRules.all())).contains(Decision.SKIP_NUMERIC);
        assertThat(evaluator.evaluate("2024", new SkipRules(true, false, true, true))).isEmpty();
    }
}
