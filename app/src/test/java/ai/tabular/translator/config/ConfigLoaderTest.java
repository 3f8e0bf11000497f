package ai.tabular.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.tabular.translator.cli.CliArguments;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationMode;
import ai.tabular.translator.language.SkipRules;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWhenOnlyTheInputIsGiven() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "data/reviews.csv");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.input()).isEqualTo(Path.of("data/reviews.csv"));
        assertThat(config.output()).isEqualTo(Path.of("data/reviews_translated.csv"));
        assertThat(config.autoSelectColumns()).isTrue();
        assertThat(config.engine()).isEqualTo(EngineId.ENGINE_A);
        assertThat(config.targetLanguage()).isEqualTo("eng_Latn");
        assertThat(config.fallbackLanguage()).isEqualTo("eng_Latn");
        assertThat(config.confidenceThreshold()).isEqualTo(0.7);
        assertThat(config.batchSize()).isEqualTo(16);
        assertThat(config.skipRules()).isEqualTo(SkipRules.all());
        assertThat(config.forcedLanguage()).isEmpty();
        assertThat(config.engineFallback()).isTrue();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.backendConfig()).isEqualTo(BackendConfig.defaults());
    }

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "reviews.xlsx",
                "-o", "out.xlsx",
                "-c", "comment, notes",
                "-l", "ru",
                "-t", "de",
                "-e", "engine-b",
                "--confidence-threshold", "0.9",
                "--fallback-language", "fr",
                "--batch-size", "8",
                "--no-skip-numeric",
                "--no-skip-english",
                "--no-engine-fallback",
                "--translation-mode", "mock",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.output()).isEqualTo(Path.of("out.xlsx"));
        assertThat(config.columns()).containsExactly("comment", "notes");
        assertThat(config.forcedLanguage()).contains("rus_Cyrl");
        assertThat(config.targetLanguage()).isEqualTo("deu_Latn");
        assertThat(config.engine()).isEqualTo(EngineId.ENGINE_B);
        assertThat(config.confidenceThreshold()).isEqualTo(0.9);
        assertThat(config.fallbackLanguage()).isEqualTo("fra_Latn");
        assertThat(config.batchSize()).isEqualTo(8);
        assertThat(config.skipRules()).isEqualTo(new SkipRules(true, false, true, false));
        assertThat(config.engineFallback()).isFalse();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_TRANSLATION_ENGINE, "argos");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "es");
        envValues.put(ConfigLoader.ENV_CONFIDENCE_THRESHOLD, "0.5");
        envValues.put(ConfigLoader.ENV_BATCH_SIZE, "4");
        envValues.put(ConfigLoader.ENV_SKIP_DATES, "false");
        envValues.put(ConfigLoader.ENV_FORCE_SOURCE_LANGUAGE, "uk");
        envValues.put(ConfigLoader.ENV_ENGINE_FALLBACK, "0");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "dry-run");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_ENGINE_A_MODEL, "custom-a");
        envValues.put(ConfigLoader.ENV_BACKEND_TIMEOUT_SECONDS, "30");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv"));

        assertThat(config.engine()).isEqualTo(EngineId.ENGINE_B);
        assertThat(config.targetLanguage()).isEqualTo("spa_Latn");
        assertThat(config.confidenceThreshold()).isEqualTo(0.5);
        assertThat(config.batchSize()).isEqualTo(4);
        assertThat(config.skipRules().skipDates()).isFalse();
        assertThat(config.forcedLanguage()).contains("ukr_Cyrl");
        assertThat(config.engineFallback()).isFalse();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.backendConfig().baseUrl()).isEqualTo("http://ollama:11434");
        assertThat(config.backendConfig().modelFor(EngineId.ENGINE_A)).isEqualTo("custom-a");
        assertThat(config.backendConfig().modelFor(EngineId.ENGINE_B)).isEqualTo(BackendConfig.DEFAULT_ENGINE_B_MODEL);
        assertThat(config.backendConfig().timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void cliOverridesEnvironment() {
        EnvironmentReader environment = key -> ConfigLoader.ENV_BATCH_SIZE.equals(key) ? Optional.of("4") : Optional.empty();

        Config config = new ConfigLoader(environment)
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv", "--batch-size", "12"));

        assertThat(config.batchSize()).isEqualTo(12);
    }

    @Test
    void missingInputIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("input");
    }

    @Test
    void unknownLanguageCodeIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv", "-t", "klingon")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("klingon");
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv", "--confidence-threshold", "1.5")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("confidenceThreshold");
    }

    @Test
    void malformedEnvironmentValueIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                key -> ConfigLoader.ENV_SKIP_NUMERIC.equals(key) ? Optional.of("maybe") : Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining(ConfigLoader.ENV_SKIP_NUMERIC);
    }

    @Test
    void outputMayNotOverwriteInput() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "in.csv", "-o", "in.csv")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }
}
