package ai.tabular.translator.config;

import ai.tabular.translator.cli.CliArguments;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationMode;
import ai.tabular.translator.language.ClassifierSettings;
import ai.tabular.translator.language.LanguageCatalog;
import ai.tabular.translator.language.SkipRules;
import ai.tabular.translator.pipeline.BatchScheduler;
import ai.tabular.translator.table.TableProviders;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_TRANSLATION_ENGINE = "TRANSLATION_ENGINE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_CONFIDENCE_THRESHOLD = "CONFIDENCE_THRESHOLD";
    static final String ENV_FALLBACK_LANGUAGE = "FALLBACK_LANGUAGE";
    static final String ENV_SKIP_NUMERIC = "SKIP_NUMERIC";
    static final String ENV_SKIP_DATES = "SKIP_DATES";
    static final String ENV_SKIP_ENGLISH = "SKIP_ENGLISH";
    static final String ENV_SKIP_EMPTY = "SKIP_EMPTY";
    static final String ENV_BATCH_SIZE = "BATCH_SIZE";
    static final String ENV_FORCE_SOURCE_LANGUAGE = "FORCE_SOURCE_LANGUAGE";
    static final String ENV_ENGINE_FALLBACK = "ENGINE_FALLBACK";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_ENGINE_A_MODEL = "ENGINE_A_MODEL";
    static final String ENV_ENGINE_B_MODEL = "ENGINE_B_MODEL";
    static final String ENV_BACKEND_TIMEOUT_SECONDS = "BACKEND_TIMEOUT_SECONDS";

    private final EnvironmentReader environmentReader;
    private final LanguageCatalog catalog;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, LanguageCatalog.defaultCatalog());
    }

    public ConfigLoader(EnvironmentReader environmentReader, LanguageCatalog catalog) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path input = arguments.input();
        if (input == null) {
            throw new IllegalArgumentException("An input file must be provided");
        }
        Path output = arguments.output() != null ? arguments.output() : TableProviders.defaultOutputPath(input);

        EngineId engine = arguments.engine() != null
                ? arguments.engine()
                : env(ENV_TRANSLATION_ENGINE).map(EngineId::from).orElse(EngineId.ENGINE_A);
        String targetLanguage = catalog.normalize(
                firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, LanguageCatalog.ENGLISH));
        String fallbackLanguage = catalog.normalize(
                firstNonBlank(arguments.fallbackLanguage(), ENV_FALLBACK_LANGUAGE, LanguageCatalog.ENGLISH));
        double threshold = arguments.confidenceThreshold() != null
                ? arguments.confidenceThreshold()
                : env(ENV_CONFIDENCE_THRESHOLD).map(value -> parseDouble(value, ENV_CONFIDENCE_THRESHOLD))
                        .orElse(ClassifierSettings.DEFAULT_CONFIDENCE_THRESHOLD);
        int batchSize = arguments.batchSize() != null
                ? arguments.batchSize()
                : env(ENV_BATCH_SIZE).map(value -> parseInteger(value, ENV_BATCH_SIZE))
                        .orElse(BatchScheduler.DEFAULT_BATCH_SIZE);
        Optional<String> forcedLanguage = Optional.ofNullable(arguments.forceLanguage())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> env(ENV_FORCE_SOURCE_LANGUAGE))
                .map(catalog::normalize);

        SkipRules skipRules = new SkipRules(
                !arguments.noSkipEmpty() && flag(ENV_SKIP_EMPTY, true),
                !arguments.noSkipNumeric() && flag(ENV_SKIP_NUMERIC, true),
                !arguments.noSkipDates() && flag(ENV_SKIP_DATES, true),
                !arguments.noSkipEnglish() && flag(ENV_SKIP_ENGLISH, true));
        boolean engineFallback = !arguments.noEngineFallback() && flag(ENV_ENGINE_FALLBACK, true);

        TranslationMode translationMode = arguments.translationMode() != null
                ? arguments.translationMode()
                : env(ENV_TRANSLATION_MODE).map(TranslationMode::from).orElse(TranslationMode.PRODUCTION);
        LogFormat logFormat = resolveLogFormat(arguments);

        BackendConfig backendConfig = new BackendConfig(
                env(ENV_OLLAMA_BASE_URL).orElse(BackendConfig.DEFAULT_BASE_URL),
                env(ENV_ENGINE_A_MODEL).orElse(BackendConfig.DEFAULT_ENGINE_A_MODEL),
                env(ENV_ENGINE_B_MODEL).orElse(BackendConfig.DEFAULT_ENGINE_B_MODEL),
                env(ENV_BACKEND_TIMEOUT_SECONDS)
                        .map(value -> Duration.ofSeconds(parseInteger(value, ENV_BACKEND_TIMEOUT_SECONDS)))
                        .orElse(BackendConfig.DEFAULT_TIMEOUT));

        List<String> columns = arguments.columns();
        return new Config(input, output, columns, engine, targetLanguage, threshold, fallbackLanguage, batchSize,
                skipRules, forcedLanguage, engineFallback, translationMode, logFormat, backendConfig);
    }

    /**
     * Log format is needed before the rest of the configuration is validated.
     */
    public LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key).filter(ConfigLoader::isNotBlank).map(String::trim);
    }

    private boolean flag(String key, boolean defaultValue) {
        return env(key).map(value -> parseBoolean(value, key)).orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw, String key) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(key + " must be a boolean: " + raw);
        };
    }

    private static int parseInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be a positive integer");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }
}
