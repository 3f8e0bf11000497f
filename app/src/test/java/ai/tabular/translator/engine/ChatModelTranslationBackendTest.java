package ai.tabular.translator.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.tabular.translator.language.LanguageCatalog;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelTranslationBackendTest {

    private final LanguageCatalog catalog = LanguageCatalog.defaultCatalog();

    @Test
    void promptNamesLanguagesAndResponseIsTrimmed() {
        List<String> prompts = new ArrayList<>();
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                prompts.add(prompt);
                return "  Excellent product!\n";
            }
        };
        ChatModelTranslationBackend backend = new ChatModelTranslationBackend(stubModel, "test-model", catalog);

        String translated = backend.translate("Отличный продукт!", "rus_Cyrl", "eng_Latn");

        assertThat(translated).isEqualTo("Excellent product!");
        assertThat(prompts).singleElement().satisfies(prompt -> {
            assertThat(prompt).contains("from Russian into English");
            assertThat(prompt).endsWith("Отличный продукт!");
        });
    }

    @Test
    @DisplayName("Batch prompt answers are matched back by their line number")
    void parsesNumberedBatchResponse() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "1. Good\n\n2) Fast delivery\n3. Thanks\n";
            }
        };
        ChatModelTranslationBackend backend = new ChatModelTranslationBackend(stubModel, "test-model", catalog);

        List<String> result = backend.translateAll(List.of("Gut", "Schnelle Lieferung", "Danke"), "de", "en");

        assertThat(result).containsExactly("Good", "Fast delivery", "Thanks");
    }

    @Test
    void incompleteBatchResponseIsAnInferenceFailure() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "1. Good";
            }
        };
        ChatModelTranslationBackend backend = new ChatModelTranslationBackend(stubModel, "test-model", catalog);

        assertThatThrownBy(() -> backend.translateAll(List.of("Gut", "Danke"), "deu_Latn", "eng_Latn"))
                .isInstanceOf(BackendInferenceException.class)
                .isNotInstanceOf(BackendResourceException.class)
                .hasMessageContaining("1 of 2");
    }

    @Test
    void outOfMemoryIsReportedAsResourceFailure() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new RuntimeException("model runner failed", new IllegalStateException("CUDA error: out of memory"));
            }
        };
        ChatModelTranslationBackend backend = new ChatModelTranslationBackend(stubModel, "test-model", catalog);

        assertThatThrownBy(() -> backend.translate("Gut", "deu_Latn", "eng_Latn"))
                .isInstanceOf(BackendResourceException.class);
    }

    @Test
    void emptyAnswerIsAnInferenceFailure() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "";
            }
        };
        ChatModelTranslationBackend backend = new ChatModelTranslationBackend(stubModel, "test-model", catalog);

        assertThatThrownBy(() -> backend.translate("Gut", "deu_Latn", "eng_Latn"))
                .isInstanceOf(BackendInferenceException.class);
    }
}
