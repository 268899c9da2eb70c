package com.dcruver.clausedrift.nlp;

import com.dcruver.clausedrift.domain.ChangeKind;

import java.util.Optional;

/**
 * Routes every call of a delegate assistant through the shared {@link AiCallGate}.
 */
public class GatedDriftAssistant implements DriftAssistant {

    private final DriftAssistant delegate;
    private final AiCallGate gate;

    public GatedDriftAssistant(DriftAssistant delegate, AiCallGate gate) {
        this.delegate = delegate;
        this.gate = gate;
    }

    @Override
    public Optional<Double> similarity(String text1, String text2) {
        return gate.call("similarity", () -> delegate.similarity(text1, text2));
    }

    @Override
    public Optional<String> summarize(String oldText, String newText, ChangeKind kind) {
        return gate.call("summary", () -> delegate.summarize(oldText, newText, kind));
    }

    @Override
    public Optional<String> explain(String clauseText, String category, String changeSummary) {
        return gate.call("explanation", () -> delegate.explain(clauseText, category, changeSummary));
    }
}
