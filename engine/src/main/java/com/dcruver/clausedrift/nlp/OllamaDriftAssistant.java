package com.dcruver.clausedrift.nlp;

import com.dcruver.clausedrift.domain.ChangeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DriftAssistant} backed by a local Ollama chat model.
 */
@Slf4j
public class OllamaDriftAssistant implements DriftAssistant {

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?|\\.\\d+");

    private static final String SYSTEM_MESSAGE =
        "You are a contract analyst. Answer concisely and in plain business language.";

    private final OllamaChatService chatService;
    private final int maxPromptChars;

    public OllamaDriftAssistant(OllamaChatService chatService, int maxPromptChars) {
        this.chatService = chatService;
        this.maxPromptChars = maxPromptChars;
    }

    @Override
    public Optional<Double> similarity(String text1, String text2) {
        String prompt = String.format("""
            Compare these two contract clauses and rate their semantic similarity on a scale of 0 to 1, where:
            - 1.0 = Identical meaning, even if worded differently
            - 0.7-0.9 = Very similar meaning with minor differences
            - 0.4-0.6 = Somewhat similar, but with notable differences
            - 0.1-0.3 = Different meanings
            - 0.0 = Completely unrelated

            Clause 1:
            %s

            Clause 2:
            %s

            Respond with ONLY a number between 0 and 1, nothing else.""",
            truncate(text1), truncate(text2));

        return chatService.chat(SYSTEM_MESSAGE, prompt).flatMap(OllamaDriftAssistant::parseScore);
    }

    @Override
    public Optional<String> summarize(String oldText, String newText, ChangeKind kind) {
        String prompt = switch (kind) {
            case ADDED -> String.format(
                "This clause was newly added to a contract. Summarize what it means in 1-2 sentences:%n%n%s",
                truncate(newText));
            case REMOVED -> String.format(
                "This clause was removed from a contract. Summarize what was removed in 1-2 sentences:%n%n%s",
                truncate(oldText));
            case MODIFIED, REWRITTEN -> String.format(
                "These two versions of a contract clause show a change. Summarize what changed in 1-2 sentences:"
                    + "%n%nOriginal:%n%s%n%nNew:%n%s",
                truncate(oldText), truncate(newText));
        };
        return chatService.chat(SYSTEM_MESSAGE, prompt);
    }

    @Override
    public Optional<String> explain(String clauseText, String category, String changeSummary) {
        String prompt = String.format("""
            A contract clause in the "%s" category has changed. Explain why this matters to a business user \
            in 2-3 sentences. Focus on practical implications.

            Clause:
            %s

            Change:
            %s

            Explain why this matters:""",
            category, truncate(clauseText), changeSummary != null ? changeSummary : "");
        return chatService.chat(SYSTEM_MESSAGE, prompt);
    }

    static Optional<Double> parseScore(String response) {
        Matcher matcher = NUMBER.matcher(response);
        if (!matcher.find()) {
            log.warn("Unparseable similarity response: {}", response);
            return Optional.empty();
        }
        double score = Double.parseDouble(matcher.group());
        return Optional.of(Math.min(1.0, Math.max(0.0, score)));
    }

    private String truncate(String text) {
        if (text == null || text.length() <= maxPromptChars) {
            return text;
        }
        return text.substring(0, maxPromptChars) + "...";
    }
}
