package ai.tabular.translator.cli;

import ai.tabular.translator.config.LogFormat;
import ai.tabular.translator.engine.EngineId;
import ai.tabular.translator.engine.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "tabular-translator", mixinStandardHelpOptions = true, version = "tabular-translator 1.0.0",
        description = "Translates selected columns of a CSV or Excel file cell by cell, offline.")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "Input file (.csv, .xlsx, .xls)")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Output file (default: <input>_translated.<ext>)")
    private Path output;

    @CommandLine.Option(names = {"-c", "--columns"}, split = ",", paramLabel = "COLUMN", description = "Columns to translate (default: detected automatically)")
    private List<String> columns = new ArrayList<>();

    @CommandLine.Option(names = {"-l", "--force-lang"}, paramLabel = "CODE", description = "Treat every text cell as this source language")
    private String forceLanguage;

    @CommandLine.Option(names = {"-t", "--target-lang"}, paramLabel = "CODE", description = "Target language (default: eng_Latn)")
    private String targetLanguage;

    @CommandLine.Option(names = {"-e", "--engine"}, converter = EngineIdConverter.class, paramLabel = "ENGINE", description = "Translation engine: engine-a or engine-b")
    private EngineId engine;

    @CommandLine.Option(names = "--confidence-threshold", paramLabel = "VALUE", description = "Minimum detection confidence, 0..1 (default: 0.7)")
    private Double confidenceThreshold;

    @CommandLine.Option(names = "--fallback-language", paramLabel = "CODE", description = "Language assumed below the confidence threshold")
    private String fallbackLanguage;

    @CommandLine.Option(names = "--batch-size", paramLabel = "COUNT", description = "Maximum cells per translation batch (default: 16)")
    private Integer batchSize;

    @CommandLine.Option(names = "--no-skip-numeric", description = "Translate numeric cells")
    private boolean noSkipNumeric;

    @CommandLine.Option(names = "--no-skip-dates", description = "Translate date cells")
    private boolean noSkipDates;

    @CommandLine.Option(names = "--no-skip-english", description = "Translate cells that already look English")
    private boolean noSkipEnglish;

    @CommandLine.Option(names = "--no-skip-empty", description = "Send empty cells through classification")
    private boolean noSkipEmpty;

    @CommandLine.Option(names = "--no-engine-fallback", description = "Do not reroute languages the selected engine lacks")
    private boolean noEngineFallback;

    @CommandLine.Option(names = "--translation-mode", converter = TranslationModeConverter.class, description = "Translation execution mode: production, dry-run, or mock")
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--analyze", description = "Print the detected column types and exit")
    private boolean analyze;

    @CommandLine.Option(names = "--list-languages", description = "Print the supported languages and exit")
    private boolean listLanguages;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Only log warnings and errors")
    private boolean quiet;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug output")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public List<String> columns() {
        List<String> trimmed = new ArrayList<>();
        for (String column : columns) {
            if (column != null && !column.isBlank()) {
                trimmed.add(column.trim());
            }
        }
        return trimmed;
    }

    public String forceLanguage() {
        return forceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public EngineId engine() {
        return engine;
    }

    public Double confidenceThreshold() {
        return confidenceThreshold;
    }

    public String fallbackLanguage() {
        return fallbackLanguage;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public boolean noSkipNumeric() {
        return noSkipNumeric;
    }

    public boolean noSkipDates() {
        return noSkipDates;
    }

    public boolean noSkipEnglish() {
        return noSkipEnglish;
    }

    public boolean noSkipEmpty() {
        return noSkipEmpty;
    }

    public boolean noEngineFallback() {
        return noEngineFallback;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean analyze() {
        return analyze;
    }

    public boolean listLanguages() {
        return listLanguages;
    }

    public boolean quiet() {
        return quiet;
    }

    public boolean verbose() {
        return verbose;
    }
}
