package com.dcruver.clausedrift.drift;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.domain.FingerprintedClause;
import com.dcruver.clausedrift.fingerprint.FingerprintEngine;
import com.dcruver.clausedrift.nlp.DriftAssistant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Aligns the clauses of two contract versions and classifies each difference.
 *
 * Matching is greedy: new clauses are visited in order and each takes the most
 * similar old clause not yet consumed (earliest on ties). This is
 * O(|old| x |new|) similarity evaluations and not a globally optimal assignment.
 *
 * <pre>
 *   s >= identical  -> no change, both consumed
 *   s >= modified   -> MODIFIED
 *   s >= rewritten  -> REWRITTEN
 *   otherwise       -> new clause ADDED, old clause stays available
 * </pre>
 * Old clauses never consumed are reported as REMOVED.
 */
@Component
@Slf4j
public class DriftDetector {

    private final FingerprintEngine fingerprintEngine;
    private final ClauseDiffer clauseDiffer;
    private final DriftAssistant assistant;
    private final DriftProperties.Detection config;

    public DriftDetector(
            FingerprintEngine fingerprintEngine,
            ClauseDiffer clauseDiffer,
            DriftProperties properties,
            @Autowired(required = false) DriftAssistant assistant) {
        this.fingerprintEngine = fingerprintEngine;
        this.clauseDiffer = clauseDiffer;
        this.config = properties.getDetection();
        this.assistant = assistant;
    }

    /**
     * Detect changes between an old version and the new version that follows it.
     *
     * @return unordered list of changes; empty when the versions are equivalent
     */
    public List<Change> detect(List<FingerprintedClause> oldClauses, List<FingerprintedClause> newClauses) {
        List<Change> changes = new ArrayList<>();
        Set<String> consumedOld = new HashSet<>();
        Set<String> consumedNew = new HashSet<>();

        for (FingerprintedClause newClause : newClauses) {
            if (consumedNew.contains(newClause.getId())) {
                log.warn("Skipping duplicate new clause {}", newClause.getId());
                continue;
            }
            FingerprintedClause bestMatch = null;
            double bestSimilarity = -1.0;

            for (FingerprintedClause oldClause : oldClauses) {
                if (consumedOld.contains(oldClause.getId())) {
                    continue;
                }
                double similarity = fingerprintEngine.similarity(
                    oldClause.getFingerprint(), newClause.getFingerprint());
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestMatch = oldClause;
                }
            }

            if (bestMatch != null) {
                bestSimilarity = refine(bestMatch, newClause, bestSimilarity);
            }

            if (bestMatch == null || bestSimilarity < config.getRewrittenThreshold()) {
                changes.add(createChange(ChangeKind.ADDED, null, newClause, 0.0));
                consumedNew.add(newClause.getId());
                continue;
            }

            consumedOld.add(bestMatch.getId());
            consumedNew.add(newClause.getId());

            if (bestSimilarity >= config.getIdenticalThreshold()) {
                log.trace("Clause {} unchanged as {}", bestMatch.getId(), newClause.getId());
            } else if (bestSimilarity >= config.getModifiedThreshold()) {
                changes.add(createChange(ChangeKind.MODIFIED, bestMatch, newClause, bestSimilarity));
            } else {
                changes.add(createChange(ChangeKind.REWRITTEN, bestMatch, newClause, bestSimilarity));
            }
        }

        for (FingerprintedClause oldClause : oldClauses) {
            if (!consumedOld.contains(oldClause.getId())) {
                changes.add(createChange(ChangeKind.REMOVED, oldClause, null, 0.0));
            }
        }

        log.info("Compared {} old and {} new clauses: {} changes", oldClauses.size(), newClauses.size(), changes.size());
        return changes;
    }

    /**
     * Blend in the assistant's semantic similarity for ambiguous matches, when enabled.
     * Only the score of the chosen candidate changes, never the choice.
     */
    private double refine(FingerprintedClause oldClause, FingerprintedClause newClause, double similarity) {
        if (!config.isSemanticRefinement() || assistant == null
                || similarity < config.getRewrittenThreshold()
                || similarity >= config.getIdenticalThreshold()) {
            return similarity;
        }

        try {
            Optional<Double> semantic = assistant.similarity(
                    oldClause.getClause().getText(), newClause.getClause().getText())
                .filter(score -> {
                    if (!Double.isFinite(score)) {
                        log.warn("Ignoring non-finite semantic similarity for {}", newClause.getId());
                        return false;
                    }
                    return true;
                });
            if (semantic.isPresent()) {
                double refined = (similarity + semantic.get()) / 2.0;
                log.debug("Refined similarity {} -> {} for {} / {}",
                    similarity, refined, oldClause.getId(), newClause.getId());
                return Math.min(1.0, Math.max(0.0, refined));
            }
        } catch (Exception e) {
            log.warn("Semantic similarity failed for {}: {}", newClause.getId(), e.getMessage());
        }
        return similarity;
    }

    private Change createChange(ChangeKind kind, FingerprintedClause oldClause,
                                FingerprintedClause newClause, double similarity) {
        Change.ChangeBuilder change = Change.builder()
            .kind(kind)
            .oldClause(oldClause != null ? oldClause.getClause() : null)
            .newClause(newClause != null ? newClause.getClause() : null)
            .similarity(similarity);

        if (oldClause != null && newClause != null) {
            change.diff(clauseDiffer.diff(oldClause.getClause(), newClause.getClause()));
        }

        if (assistant != null && config.isSummarizeChanges()) {
            try {
                String oldText = oldClause != null ? oldClause.getClause().getText() : "";
                String newText = newClause != null ? newClause.getClause().getText() : "";
                assistant.summarize(oldText, newText, kind).ifPresent(change::summary);
            } catch (Exception e) {
                log.warn("Error generating summary for {} change: {}", kind.getKey(), e.getMessage());
            }
        }

        return change.build();
    }
}
