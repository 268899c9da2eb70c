package com.dcruver.clausedrift.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Word-level difference between the old and new text of a matched clause.
 */
@Value
@Builder
public class ClauseDiff {
    List<String> addedWords;
    List<String> removedWords;
    int wordCountChange;
    String unifiedDiff;

    public boolean isEmpty() {
        return addedWords.isEmpty() && removedWords.isEmpty();
    }
}
