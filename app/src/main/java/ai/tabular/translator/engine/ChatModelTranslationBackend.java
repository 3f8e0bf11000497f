package ai.tabular.translator.engine;

import ai.tabular.translator.language.LanguageCatalog;
import ai.tabular.translator.language.LanguageInfo;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Backend driven by a locally hosted model through a LangChain4j {@link ChatModel}.
 */
public class ChatModelTranslationBackend implements TranslationBackend {

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(\\d+)[.)]\\s?(.*)$");
    private static final List<String> RESOURCE_MARKERS = List.of(
            "out of memory", "resource_exhausted", "insufficient memory", "cuda error", "429");

    private final ChatModel model;
    private final String modelName;
    private final LanguageCatalog catalog;

    public ChatModelTranslationBackend(ChatModel model, String modelName, LanguageCatalog catalog) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public String translate(String text, String sourceCode, String targetCode) {
        String response = call(buildPrompt(text, sourceCode, targetCode));
        if (response == null || response.isBlank()) {
            throw new BackendInferenceException("Model '%s' returned an empty translation".formatted(modelName), null);
        }
        return response.strip();
    }

    @Override
    public List<String> translateAll(List<String> texts, String sourceCode, String targetCode) {
        if (texts.isEmpty()) {
            return List.of();
        }
        if (texts.size() == 1 || texts.stream().anyMatch(text -> text.contains("\n"))) {
            return TranslationBackend.super.translateAll(texts, sourceCode, targetCode);
        }
        String response = call(buildBatchPrompt(texts, sourceCode, targetCode));
        List<String> lines = response == null ? List.of() : Arrays.stream(response.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
        List<String> result = new ArrayList<>(texts.size());
        for (String line : lines) {
            Matcher matcher = NUMBERED_LINE.matcher(line);
            if (matcher.matches() && Integer.parseInt(matcher.group(1)) == result.size() + 1) {
                result.add(matcher.group(2).strip());
            }
        }
        if (result.size() != texts.size() || result.stream().anyMatch(String::isBlank)) {
            throw new BackendInferenceException("Model '%s' returned %d of %d translations"
                    .formatted(modelName, result.size(), texts.size()), null);
        }
        return result;
    }

    private String call(String prompt) {
        try {
            return model.chat(prompt);
        } catch (RuntimeException ex) {
            if (isResourceError(ex)) {
                throw new BackendResourceException("Model '%s' ran out of resources".formatted(modelName), ex);
            }
            throw new BackendInferenceException("Model '%s' call failed".formatted(modelName), ex);
        }
    }

    private String buildPrompt(String text, String sourceCode, String targetCode) {
        return """
Translate the text below from %s into %s.
Rules:
- Output only the translation, without quotes, notes or explanations.
- Keep numbers, codes, URLs and e-mail addresses unchanged.

%s""".formatted(languageName(sourceCode), languageName(targetCode), text);
    }

    private String buildBatchPrompt(List<String> texts, String sourceCode, String targetCode) {
        StringBuilder numbered = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            numbered.append(i + 1).append(". ").append(texts.get(i)).append('\n');
        }
        return """
Translate each numbered line below from %s into %s.
Rules:
- Answer with exactly %d numbered lines, in the same order, formatted as "<number>. <translation>".
- Output only the translations, without notes or explanations.
- Keep numbers, codes, URLs and e-mail addresses unchanged.

%s""".formatted(languageName(sourceCode), languageName(targetCode), texts.size(), numbered);
    }

    private String languageName(String code) {
        return catalog.resolve(code).map(LanguageInfo::name).orElse(code);
    }

    private static boolean isResourceError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : RESOURCE_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
