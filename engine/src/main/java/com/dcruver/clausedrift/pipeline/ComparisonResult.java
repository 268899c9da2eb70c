package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.Clause;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one old/new comparison. A failed comparison carries only its error.
 */
@Value
@Builder
public class ComparisonResult {
    String comparisonId;
    String oldVersionId;
    String newVersionId;
    boolean success;
    String error;
    Instant completedAt;

    List<Clause> oldClauses;
    List<Clause> newClauses;
    List<Change> changes;
    List<DriftAlert> alerts;
    ComparisonStats stats;

    static ComparisonResult failed(ComparisonRequest request, String error) {
        return ComparisonResult.builder()
            .comparisonId(request.getComparisonId())
            .oldVersionId(request.getOldVersionId())
            .newVersionId(request.getNewVersionId())
            .success(false)
            .error(error)
            .completedAt(Instant.now())
            .oldClauses(List.of())
            .newClauses(List.of())
            .changes(List.of())
            .alerts(List.of())
            .build();
    }

    /**
     * Changes ordered by descending risk score, then kind
     */
    public List<Change> getChangesByRisk() {
        return changes.stream()
            .sorted(Comparator.comparingInt(Change::getRiskScore).reversed()
                .thenComparing(Change::getKind))
            .toList();
    }
}
