package ai.tabular.translator.cli;

import ai.tabular.translator.config.BackendConfig;
import ai.tabular.translator.config.Config;
import ai.tabular.translator.config.ConfigLoader;
import ai.tabular.translator.config.SystemEnvironmentReader;
import ai.tabular.translator.engine.BackendFactory;
import ai.tabular.translator.engine.BroadCoverageEngine;
import ai.tabular.translator.engine.ChatModelTranslationBackend;
import ai.tabular.translator.engine.EngineAdapter;
import ai.tabular.translator.engine.EngineCapabilities;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.EngineRouter;
import ai.tabular.translator.engine.LightweightEngine;
import ai.tabular.translator.engine.MockTranslationBackend;
import ai.tabular.translator.engine.PassThroughTranslationBackend;
import ai.tabular.translator.engine.TranslationBackend;
import ai.tabular.translator.engine.TranslationMode;
import ai.tabular.translator.language.ClassifierSettings;
import ai.tabular.translator.language.Decision;
import ai.tabular.translator.language.LanguageCatalog;
import ai.tabular.translator.language.LanguageClassifier;
import ai.tabular.translator.language.LanguageIdentifier;
import ai.tabular.translator.language.LanguageInfo;
import ai.tabular.translator.language.LinguaLanguageIdentifier;
import ai.tabular.translator.language.SkipRuleEvaluator;
import ai.tabular.translator.logging.LoggingConfigurator;
import ai.tabular.translator.pipeline.BatchScheduler;
import ai.tabular.translator.pipeline.ColumnAnalysis;
import ai.tabular.translator.pipeline.ColumnAnalyzer;
import ai.tabular.translator.pipeline.ColumnProjector;
import ai.tabular.translator.pipeline.PipelineOrchestrator;
import ai.tabular.translator.pipeline.PipelineOutcome;
import ai.tabular.translator.pipeline.RunControl;
import ai.tabular.translator.table.Table;
import ai.tabular.translator.table.TableIoException;
import ai.tabular.translator.table.TableProvider;
import ai.tabular.translator.table.TableProviders;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private final ConfigLoader configLoader;
    private final Function<LanguageCatalog, LanguageIdentifier> identifierFactory;
    private final RunControl runControl;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                catalog -> new LinguaLanguageIdentifier(catalog, false),
                new RunControl());
    }

    CliApplication(ConfigLoader configLoader,
                   Function<LanguageCatalog, LanguageIdentifier> identifierFactory,
                   RunControl runControl) {
        this.configLoader = configLoader;
        this.identifierFactory = identifierFactory;
        this.runControl = runControl;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        return run(args, new PrintWriter(System.out, true));
    }

    int run(String[] args, PrintWriter out) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_USAGE;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return EXIT_OK;
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return EXIT_OK;
        }

        LanguageCatalog catalog = LanguageCatalog.defaultCatalog();
        if (cliArguments.listLanguages()) {
            printLanguages(catalog, out);
            return EXIT_OK;
        }

        Config config;
        try {
            LoggingConfigurator.configure(configLoader.resolveLogFormat(cliArguments));
            LoggingConfigurator.applyVerbosity(cliArguments.quiet(), cliArguments.verbose());
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return EXIT_USAGE;
        }

        try {
            return execute(config, catalog, cliArguments.analyze(), out);
        } catch (TableIoException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid input: {}", ex.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException ex) {
            LOGGER.error("Translation run failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int execute(Config config, LanguageCatalog catalog, boolean analyzeOnly, PrintWriter out) {
        TableProvider reader = TableProviders.forPath(config.input());
        Table table = reader.read(config.input());

        LanguageClassifier classifier = new LanguageClassifier(identifierFactory.apply(catalog), new SkipRuleEvaluator(),
                config.skipRules(), new ClassifierSettings(config.confidenceThreshold(), config.fallbackLanguage(),
                config.targetLanguage(), config.forcedLanguage()));
        ColumnAnalyzer analyzer = new ColumnAnalyzer(classifier);

        if (analyzeOnly) {
            printAnalysis(analyzer.analyze(table), catalog, out);
            return EXIT_OK;
        }

        List<String> columns = config.columns();
        if (config.autoSelectColumns()) {
            columns = analyzer.selectColumns(table);
            LOGGER.info("Auto-selected columns: {}", columns);
        }
        if (columns.isEmpty()) {
            LOGGER.warn("No column needs translation; nothing written");
            return EXIT_OK;
        }
        List<String> selected = columns;

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(classifier, buildRouter(config, catalog),
                new BatchScheduler(config.batchSize()), new ColumnProjector(isoCode(catalog, config.targetLanguage())),
                config.targetLanguage());
        orchestrator.setProgressListener((completed, total, message) ->
                LOGGER.info("Progress {}/{}: {}", completed, total, message));

        PipelineOutcome outcome = runWithShutdownHook(() -> orchestrator.run(table, selected, runControl));
        logOutcome(outcome);
        if (outcome.cancelled()) {
            LOGGER.warn("Run cancelled; {} was not written", config.output());
            return EXIT_CANCELLED;
        }
        TableProviders.forPath(config.output()).write(outcome.table(), config.output());
        LOGGER.info("Wrote {}", config.output());
        return EXIT_OK;
    }

    private PipelineOutcome runWithShutdownHook(Supplier<PipelineOutcome> pipeline) {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            runControl.cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "cancel-on-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return pipeline.get();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ex) {
                LOGGER.debug("JVM already shutting down");
            }
        }
    }

    EngineRouter buildRouter(Config config, LanguageCatalog catalog) {
        EngineCapabilities capabilities = EngineCapabilities.standard(catalog);
        BackendFactory backends = buildBackendFactory(config, catalog);
        Map<EngineId, EngineAdapter> engines = new EnumMap<>(EngineId.class);
        engines.put(EngineId.ENGINE_A, new BroadCoverageEngine(capabilities.get(EngineId.ENGINE_A),
                backends.select(config.translationMode(), EngineId.ENGINE_A)));
        engines.put(EngineId.ENGINE_B, new LightweightEngine(capabilities.get(EngineId.ENGINE_B),
                backends.select(config.translationMode(), EngineId.ENGINE_B), catalog));
        EngineAdapter selected = engines.remove(config.engine());
        List<EngineAdapter> ordered = new ArrayList<>();
        ordered.add(selected);
        ordered.addAll(engines.values());
        LOGGER.info("Engine {} selected ({} mode, fallback {})", config.engine(),
                config.translationMode(), config.engineFallback() ? "enabled" : "disabled");
        return new EngineRouter(ordered, config.engineFallback());
    }

    private BackendFactory buildBackendFactory(Config config, LanguageCatalog catalog) {
        Map<EngineId, TranslationBackend> production = new EnumMap<>(EngineId.class);
        if (config.translationMode() == TranslationMode.PRODUCTION) {
            BackendConfig backendConfig = config.backendConfig();
            for (EngineId engineId : EngineId.values()) {
                String modelName = backendConfig.modelFor(engineId);
                production.put(engineId, new ChatModelTranslationBackend(
                        createOllamaChatModel(backendConfig, modelName), modelName, catalog));
            }
        }
        return new BackendFactory(production, new PassThroughTranslationBackend(), new MockTranslationBackend());
    }

    private ChatModel createOllamaChatModel(BackendConfig backendConfig, String modelName) {
        try {
            LOGGER.info("Using Ollama model '{}' via {}", modelName, backendConfig.baseUrl());
            return OllamaChatModel.builder()
                    .baseUrl(backendConfig.baseUrl())
                    .modelName(modelName)
                    .temperature(0.0)
                    .timeout(backendConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model " + modelName, ex);
        }
    }

    private static String isoCode(LanguageCatalog catalog, String code) {
        return catalog.byCode(code).map(LanguageInfo::isoCode)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported target language: " + code));
    }

    private void logOutcome(PipelineOutcome outcome) {
        LOGGER.info("Columns translated: {}, cells translated: {}, failures: {}, elapsed {} ms",
                outcome.columnsTranslated(), outcome.cellsTranslated(), outcome.cellsFailed(), outcome.elapsed().toMillis());
        LOGGER.info("Skipped: empty {}, numeric {}, dates {}, already in target {}, low confidence {}",
                outcome.count(Decision.SKIP_EMPTY), outcome.count(Decision.SKIP_NUMERIC), outcome.count(Decision.SKIP_DATE),
                outcome.count(Decision.SKIP_ENGLISH), outcome.count(Decision.LOW_CONFIDENCE_FALLBACK));
        outcome.unitsPerEngine().forEach((engine, units) -> LOGGER.info("{} translated {} cells", engine, units));
        for (String warning : outcome.warnings()) {
            LOGGER.warn(warning);
        }
        if (outcome.cellsFailed() > outcome.warnings().size()) {
            LOGGER.warn("... and {} more failures", outcome.cellsFailed() - outcome.warnings().size());
        }
    }

    private static void printLanguages(LanguageCatalog catalog, PrintWriter out) {
        out.printf("%-10s %-4s %-24s %-16s %s%n", "CODE", "ISO", "NAME", "FAMILY", "ENGINE-B");
        for (LanguageInfo language : catalog.languages()) {
            out.printf("%-10s %-4s %-24s %-16s %s%n", language.code(), language.isoCode(), language.name(),
                    language.family(), language.lightweightPack() ? "yes" : "no");
        }
        out.flush();
    }

    private static void printAnalysis(List<ColumnAnalysis> analyses, LanguageCatalog catalog, PrintWriter out) {
        out.printf("%-24s %-13s %-8s %-24s %-10s %s%n", "COLUMN", "TYPE", "SAMPLED", "LANGUAGE", "CONFIDENCE", "TRANSLATE");
        for (ColumnAnalysis analysis : analyses) {
            out.printf("%-24s %-13s %-8d %-24s %-10.2f %s%n", analysis.columnId(), analysis.type().label(),
                    analysis.sampledCells(), analysis.dominantLanguage().map(catalog::displayName).orElse("-"),
                    analysis.averageConfidence(), analysis.autoSelected() ? "yes" : "no");
        }
        out.flush();
    }
}
