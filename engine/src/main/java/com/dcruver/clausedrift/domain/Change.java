package com.dcruver.clausedrift.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A detected difference between two versions of a contract.
 *
 * ADDED changes have no old clause, REMOVED changes have no new clause,
 * MODIFIED and REWRITTEN changes have both. Risk fields are filled in
 * once by the risk classifier via {@link #withRisk(RiskAssessment)}.
 */
@Value
@With
public class Change {
    ChangeKind kind;
    Clause oldClause;
    Clause newClause;
    double similarity;
    String summary;        // optional AI summary
    ClauseDiff diff;       // MODIFIED/REWRITTEN only
    RiskAssessment risk;   // null until classified

    @Builder
    public Change(ChangeKind kind, Clause oldClause, Clause newClause, double similarity,
                  String summary, ClauseDiff diff, RiskAssessment risk) {
        if (kind == null) {
            throw new IllegalArgumentException("Change kind is required");
        }
        boolean needsOld = kind != ChangeKind.ADDED;
        boolean needsNew = kind != ChangeKind.REMOVED;
        if (needsOld != (oldClause != null) || needsNew != (newClause != null)) {
            throw new IllegalArgumentException(
                "Clause presence does not match change kind " + kind);
        }
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("Similarity out of range: " + similarity);
        }
        this.kind = kind;
        this.oldClause = oldClause;
        this.newClause = newClause;
        this.similarity = similarity;
        this.summary = summary;
        this.diff = diff;
        this.risk = risk;
    }

    /**
     * The clause a risk assessment is based on: the new clause when present, else the old one
     */
    public Clause getSubjectClause() {
        return newClause != null ? newClause : oldClause;
    }

    public String getOldClauseId() {
        return oldClause != null ? oldClause.getId() : null;
    }

    public String getNewClauseId() {
        return newClause != null ? newClause.getId() : null;
    }

    public ChangeMagnitude getMagnitude() {
        return ChangeMagnitude.of(similarity);
    }

    public boolean isClassified() {
        return risk != null;
    }

    public RiskLevel getRiskLevel() {
        return risk != null ? risk.getLevel() : null;
    }

    public int getRiskScore() {
        return risk != null ? risk.getScore() : 0;
    }

    public String getExplanation() {
        return risk != null ? risk.getExplanation() : null;
    }
}
