package com.dcruver.clausedrift.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Thin wrapper over a Spring AI {@link ChatModel} that never throws.
 */
@Slf4j
public class OllamaChatService {

    private final ChatModel chatModel;

    public OllamaChatService(ChatModel chatModel) {
        this.chatModel = chatModel;
        log.info("OllamaChatService initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    /**
     * Generate a response with optional system message.
     *
     * @return the trimmed response text, or empty when the model fails or answers blank
     */
    public Optional<String> chat(String systemMessage, String userMessage) {
        List<Message> messages = new ArrayList<>();

        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(new SystemMessage(systemMessage));
        }

        messages.add(new UserMessage(userMessage));

        try {
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response == null || response.getResults().isEmpty()) {
                log.warn("No response generated");
                return Optional.empty();
            }

            String text = response.getResult().getOutput().getText();
            return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
        } catch (Exception e) {
            log.error("Failed to generate chat response", e);
            return Optional.empty();
        }
    }
}
