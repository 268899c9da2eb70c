package com.dcruver.clausedrift.risk;

import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.domain.ClauseCategory;
import com.dcruver.clausedrift.domain.RiskLevel;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rule-based explanation text, used whenever no AI explanation is available.
 */
final class ExplanationTemplates {

    private static final Map<ClauseCategory, String> CATEGORY_IMPACTS = new EnumMap<>(Map.of(
        ClauseCategory.LIABILITY, "This affects your legal liability and potential damages.",
        ClauseCategory.DATA_USAGE, "This impacts how your data is collected, used, or shared.",
        ClauseCategory.TERMINATION, "This changes the terms for ending the contract.",
        ClauseCategory.JURISDICTION, "This affects which laws apply and where disputes are resolved.",
        ClauseCategory.PAYMENT, "This impacts pricing, billing, or refund terms.",
        ClauseCategory.INTELLECTUAL_PROPERTY, "This affects ownership and usage rights.",
        ClauseCategory.SERVICE_LEVEL, "This changes service guarantees and uptime commitments.",
        ClauseCategory.MARKETING, "This affects marketing communications and promotional usage."
    ));

    private static final String DEFAULT_IMPACT = "This may affect your contract terms.";

    private static final Map<ChangeKind, String> CHANGE_DESCRIPTIONS = new EnumMap<>(Map.of(
        ChangeKind.ADDED, "A new clause was added",
        ChangeKind.REMOVED, "An existing clause was removed",
        ChangeKind.MODIFIED, "A clause was modified",
        ChangeKind.REWRITTEN, "A clause was significantly rewritten"
    ));

    private static final Map<RiskLevel, String> URGENCY = new EnumMap<>(Map.of(
        RiskLevel.CRITICAL, "Review this change carefully before accepting.",
        RiskLevel.HIGH, "Review this change carefully before accepting.",
        RiskLevel.MEDIUM, "Consider reviewing this change.",
        RiskLevel.LOW, "This is a minor change."
    ));

    private ExplanationTemplates() {
    }

    static String explain(ChangeKind kind, ClauseCategory category, RiskLevel level) {
        String section = category != null ? category.getDisplayName() : "contract";
        String impact = category != null ? CATEGORY_IMPACTS.get(category) : DEFAULT_IMPACT;
        return String.format("%s in the %s section. %s %s",
            CHANGE_DESCRIPTIONS.get(kind), section, impact, URGENCY.get(level));
    }
}
