package com.dcruver.clausedrift.reporting;

import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.pipeline.ComparisonResult;
import com.dcruver.clausedrift.pipeline.ComparisonStats;
import com.dcruver.clausedrift.pipeline.DriftAlert;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders a comparison result as an Org-mode report.
 */
@Component
public class DriftReportGenerator {

    public String render(ComparisonResult result) {
        StringBuilder sb = new StringBuilder();

        sb.append(":PROPERTIES:\n");
        sb.append(":ID:       ").append(result.getComparisonId()).append("\n");
        sb.append(":CREATED:  [").append(result.getCompletedAt()).append("]\n");
        sb.append(":TAGS:     contract drift\n");
        sb.append(":END:\n");
        sb.append(String.format("* Contract Drift Report - %s -> %s%n%n",
            result.getOldVersionId(), result.getNewVersionId()));

        if (!result.isSuccess()) {
            sb.append("** Failed\n\n").append(result.getError()).append("\n");
            return sb.toString();
        }

        ComparisonStats stats = result.getStats();
        sb.append("** Summary\n\n");
        sb.append(String.format("- Clauses: %d old, %d new%n", stats.getOldClauses(), stats.getNewClauses()));
        sb.append(String.format("- Changes detected: %d%n", stats.getChangesDetected()));
        for (ChangeKind kind : ChangeKind.values()) {
            sb.append(String.format("  - %s: %d%n", kind.getKey(), stats.getChangesByKind().getOrDefault(kind, 0)));
        }
        sb.append(String.format("- High-risk changes: %d%n", stats.getHighRiskChanges()));
        sb.append(String.format("- Alerts: %d%n%n", stats.getAlertsCreated()));

        sb.append("** Alerts\n\n");
        if (result.getAlerts().isEmpty()) {
            sb.append("No alerts.\n\n");
        } else {
            for (DriftAlert alert : result.getAlerts()) {
                sb.append("- ").append(alert.getMessage()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("** Changes\n\n");
        if (result.getChanges().isEmpty()) {
            sb.append("No changes detected.\n");
        }
        for (Change change : result.getChangesByRisk()) {
            appendChange(sb, change);
        }

        return sb.toString();
    }

    private void appendChange(StringBuilder sb, Change change) {
        sb.append(String.format("*** %s %s [%s %d]%n",
            change.getKind(),
            change.getSubjectClause().getId(),
            change.getRiskLevel(),
            change.getRiskScore()));
        if (change.getOldClause() != null && change.getNewClause() != null) {
            sb.append(String.format("- Similarity: %.2f (%s)%n",
                change.getSimilarity(), change.getMagnitude().name().toLowerCase(Locale.ROOT)));
        }
        if (change.getSubjectClause().getCategory() != null) {
            sb.append("- Category: ").append(change.getSubjectClause().getCategory().getDisplayName()).append("\n");
        }
        if (change.getSummary() != null) {
            sb.append("- Summary: ").append(change.getSummary()).append("\n");
        }
        sb.append("- Why it matters: ").append(change.getExplanation()).append("\n");
        if (change.getDiff() != null && !change.getDiff().isEmpty()) {
            sb.append("- Removed: ").append(String.join(" ", change.getDiff().getRemovedWords())).append("\n");
            sb.append("- Added: ").append(String.join(" ", change.getDiff().getAddedWords())).append("\n");
        }
        sb.append("\n");
    }
}
