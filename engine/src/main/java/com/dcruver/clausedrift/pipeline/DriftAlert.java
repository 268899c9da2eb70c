package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.RiskLevel;
import lombok.Value;

/**
 * A change whose risk reached the alert threshold. Delivery is up to a {@link ComparisonResultSink}.
 */
@Value
public class DriftAlert {
    String comparisonId;
    Change change;
    RiskLevel level;
    String message;

    static DriftAlert of(String comparisonId, Change change) {
        String clauseId = change.getSubjectClause().getId();
        String message = String.format("%s risk: clause %s %s (score %d)",
            change.getRiskLevel(), clauseId, change.getKind().getKey(), change.getRiskScore());
        return new DriftAlert(comparisonId, change, change.getRiskLevel(), message);
    }
}
