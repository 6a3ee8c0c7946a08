package com.dcruver.organizer.config;

import com.dcruver.organizer.nlp.ChatModelClassifier;
import com.dcruver.organizer.nlp.Classifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Builds the chat model behind the document classifier. The provider is
 * chosen by {@code organizer.ai.provider}; nothing else in the application
 * knows which one is in use.
 *
 * Only active when {@code organizer.ai.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "organizer.ai.enabled", havingValue = "true")
@Slf4j
public class SpringAIConfiguration {

    static final String OLLAMA_DEFAULT_URL = "http://127.0.0.1:11434";
    static final String OLLAMA_DEFAULT_MODEL = "llama3.1";
    static final String OPENAI_DEFAULT_URL = "https://api.openai.com";
    static final String OPENAI_DEFAULT_MODEL = "gpt-4o-mini";

    @Bean
    public ChatModel classifierChatModel(OrganizerProperties properties) {
        OrganizerProperties.Ai ai = properties.getAi();
        String provider = ai.getProvider() == null ? "ollama" : ai.getProvider().trim().toLowerCase(Locale.ROOT);

        return switch (provider) {
            case "ollama" -> ollamaChatModel(ai);
            case "openai" -> openAiChatModel(ai);
            default -> throw new IllegalStateException("Unknown organizer.ai.provider: " + ai.getProvider()
                + " (expected ollama or openai)");
        };
    }

    @Bean
    public Classifier classifier(ChatModel classifierChatModel, OrganizerProperties properties) {
        return new ChatModelClassifier(classifierChatModel, properties.getAi());
    }

    private ChatModel ollamaChatModel(OrganizerProperties.Ai ai) {
        String baseUrl = orDefault(ai.getBaseUrl(), OLLAMA_DEFAULT_URL);
        String model = orDefault(ai.getModel(), OLLAMA_DEFAULT_MODEL);
        log.info("Creating Ollama chat model {} at {}", model, baseUrl);

        OllamaApi ollamaApi = OllamaApi.builder()
            .baseUrl(baseUrl)
            .build();

        var options = OllamaOptions.builder()
            .model(model)
            .temperature(ai.getTemperature())
            .build();

        // Models must already be present in Ollama
        var managementOptions = ModelManagementOptions.builder()
            .pullModelStrategy(PullModelStrategy.NEVER)
            .build();

        return OllamaChatModel.builder()
            .ollamaApi(ollamaApi)
            .defaultOptions(options)
            .modelManagementOptions(managementOptions)
            .build();
    }

    private ChatModel openAiChatModel(OrganizerProperties.Ai ai) {
        String baseUrl = orDefault(ai.getBaseUrl(), OPENAI_DEFAULT_URL);
        String model = orDefault(ai.getModel(), OPENAI_DEFAULT_MODEL);
        String apiKey = orDefault(ai.getApiKey(), System.getenv("OPENAI_API_KEY"));
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("organizer.ai.api-key (or OPENAI_API_KEY) is required for the openai provider");
        }
        log.info("Creating OpenAI chat model {} at {}", model, baseUrl);

        OpenAiApi openAiApi = OpenAiApi.builder()
            .baseUrl(baseUrl)
            .apiKey(apiKey)
            .build();

        var options = OpenAiChatOptions.builder()
            .model(model)
            .temperature(ai.getTemperature())
            .build();

        return OpenAiChatModel.builder()
            .openAiApi(openAiApi)
            .defaultOptions(options)
            .build();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
