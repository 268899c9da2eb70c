package com.dcruver.clausedrift.drift;

import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.ClauseDiff;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Word-level and line-level diffs between two versions of a clause.
 */
@Component
public class ClauseDiffer {

    public ClauseDiff diff(Clause oldClause, Clause newClause) {
        List<String> oldWords = words(oldClause.getText());
        List<String> newWords = words(newClause.getText());

        Patch<String> patch = DiffUtils.diff(oldWords, newWords);
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            removed.addAll(delta.getSource().getLines());
            added.addAll(delta.getTarget().getLines());
        }

        return ClauseDiff.builder()
            .addedWords(List.copyOf(added))
            .removedWords(List.copyOf(removed))
            .wordCountChange(newWords.size() - oldWords.size())
            .unifiedDiff(unifiedDiff(oldClause, newClause))
            .build();
    }

    /**
     * Unified diff of the clause texts, one sentence per line so edits stay readable
     */
    String unifiedDiff(Clause oldClause, Clause newClause) {
        List<String> originalLines = sentences(oldClause.getText());
        List<String> revisedLines = sentences(newClause.getText());

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "original/" + oldClause.getId(),
            "revised/" + newClause.getId(),
            originalLines,
            patch,
            1
        );

        return String.join("\n", unifiedDiff);
    }

    private static List<String> words(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? List.of() : Arrays.asList(stripped.split("\\s+"));
    }

    private static List<String> sentences(String text) {
        return Arrays.stream(text.strip().split("(?<=[.;:])\\s+"))
            .filter(s -> !s.isBlank())
            .toList();
    }
}
