package com.dcruver.clausedrift.nlp;

import com.dcruver.clausedrift.domain.ChangeKind;

import java.util.Optional;

/**
 * Optional language-model collaborator for the comparison pipeline.
 *
 * Every method signals "no result" with an empty Optional rather than an
 * exception, so callers always keep a rule-based path.
 */
public interface DriftAssistant {

    /**
     * Semantic similarity of two clause texts in [0, 1]
     */
    Optional<Double> similarity(String text1, String text2);

    /**
     * One or two sentence summary of what changed
     */
    Optional<String> summarize(String oldText, String newText, ChangeKind kind);

    /**
     * Why a change in a clause of the given category matters to a business reader
     */
    Optional<String> explain(String clauseText, String category, String changeSummary);
}
