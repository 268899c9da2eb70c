package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.domain.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ComparisonStats {
    int oldClauses;
    int newClauses;
    int changesDetected;
    int alertsCreated;
    int highRiskChanges;
    Map<ChangeKind, Integer> changesByKind;

    static ComparisonStats of(int oldClauses, int newClauses, List<Change> changes, int alerts) {
        Map<ChangeKind, Integer> byKind = new EnumMap<>(ChangeKind.class);
        for (ChangeKind kind : ChangeKind.values()) {
            byKind.put(kind, 0);
        }
        int highRisk = 0;
        for (Change change : changes) {
            byKind.merge(change.getKind(), 1, Integer::sum);
            if (change.getRiskLevel() != null && change.getRiskLevel().isAtLeast(RiskLevel.HIGH)) {
                highRisk++;
            }
        }
        return ComparisonStats.builder()
            .oldClauses(oldClauses)
            .newClauses(newClauses)
            .changesDetected(changes.size())
            .alertsCreated(alerts)
            .highRiskChanges(highRisk)
            .changesByKind(byKind)
            .build();
    }
}
