package com.dcruver.clausedrift.config;

import com.dcruver.clausedrift.nlp.AiCallGate;
import com.dcruver.clausedrift.nlp.DriftAssistant;
import com.dcruver.clausedrift.nlp.GatedDriftAssistant;
import com.dcruver.clausedrift.nlp.OllamaChatService;
import com.dcruver.clausedrift.nlp.OllamaDriftAssistant;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Ollama-backed drift assistant. Only active with {@code drift.ai.enabled=true};
 * without it no {@link DriftAssistant} bean exists and every stage uses its rule-based path.
 */
@Configuration
@ConditionalOnProperty(name = "drift.ai.enabled", havingValue = "true")
@Slf4j
public class DriftAssistantConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.chat.options.model:llama3.1:8b}")
    private String chatModelName;

    @Value("${spring.ai.ollama.chat.options.temperature:0.2}")
    private Double temperature;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    @Bean
    public ChatModel chatModel(OllamaApi ollamaApi, ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Creating ChatModel with Ollama model: {}", chatModelName);

        var options = OllamaOptions.builder()
                .model(chatModelName)
                .temperature(temperature)
                .build();

        // Models must already exist in Ollama
        var managementOptions = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(options)
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(managementOptions)
                .build();
    }

    @Bean
    public OllamaChatService ollamaChatService(ChatModel chatModel) {
        return new OllamaChatService(chatModel);
    }

    @Bean
    public DriftAssistant driftAssistant(OllamaChatService chatService, AiCallGate gate, DriftProperties properties) {
        log.info("AI drift assistant enabled");
        return new GatedDriftAssistant(
            new OllamaDriftAssistant(chatService, properties.getAi().getMaxPromptChars()), gate);
    }
}
