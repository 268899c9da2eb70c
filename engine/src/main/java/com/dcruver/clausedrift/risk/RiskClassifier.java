package com.dcruver.clausedrift.risk;

import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.ClauseCategory;
import com.dcruver.clausedrift.domain.RiskAssessment;
import com.dcruver.clausedrift.domain.RiskLevel;
import com.dcruver.clausedrift.nlp.DriftAssistant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the business risk of a detected change.
 *
 * score = categoryWeight * kindWeight * (1 + 2 * (1 - similarity)),
 * reported as min(100, round(score * 3)) and banded LOW/MEDIUM/HIGH/CRITICAL.
 */
@Component
@Slf4j
public class RiskClassifier {

    static final int UNCATEGORIZED_WEIGHT = 2;

    private static final Map<ClauseCategory, Integer> CATEGORY_WEIGHTS = new EnumMap<>(Map.of(
        ClauseCategory.LIABILITY, 10,
        ClauseCategory.DATA_USAGE, 10,
        ClauseCategory.INTELLECTUAL_PROPERTY, 8,
        ClauseCategory.TERMINATION, 7,
        ClauseCategory.PAYMENT, 7,
        ClauseCategory.JURISDICTION, 6,
        ClauseCategory.SERVICE_LEVEL, 5,
        ClauseCategory.MARKETING, 3
    ));

    private static final Map<ChangeKind, Double> KIND_WEIGHTS = new EnumMap<>(Map.of(
        ChangeKind.REMOVED, 1.5,
        ChangeKind.REWRITTEN, 1.3,
        ChangeKind.MODIFIED, 1.0,
        ChangeKind.ADDED, 0.8
    ));

    private final DriftAssistant assistant;

    public RiskClassifier(@Autowired(required = false) DriftAssistant assistant) {
        this.assistant = assistant;
    }

    /**
     * Classify a change against the clause it concerns.
     */
    public RiskAssessment classify(Change change, Clause clause) {
        ClauseCategory category = clause != null ? clause.getCategory() : null;
        int score = score(category, change.getKind(), change.getSimilarity());
        RiskLevel level = RiskLevel.fromScore(score);

        Optional<String> aiExplanation = aiExplanation(change, clause, category);
        String explanation = aiExplanation.orElseGet(
            () -> ExplanationTemplates.explain(change.getKind(), category, level));

        return RiskAssessment.builder()
            .level(level)
            .score(score)
            .explanation(explanation)
            .aiExplained(aiExplanation.isPresent())
            .build();
    }

    public Change classify(Change change) {
        return change.withRisk(classify(change, change.getSubjectClause()));
    }

    /**
     * Integer risk score in [0, 100]
     */
    public static int score(ClauseCategory category, ChangeKind kind, double similarity) {
        int categoryWeight = category != null ? CATEGORY_WEIGHTS.get(category) : UNCATEGORIZED_WEIGHT;
        double kindWeight = KIND_WEIGHTS.get(kind);
        double magnitude = 1.0 - similarity;

        double raw = categoryWeight * kindWeight * (1 + 2 * magnitude);
        return (int) Math.min(100, Math.round(raw * 3));
    }

    public static boolean shouldAlert(RiskLevel level) {
        return shouldAlert(level, RiskLevel.HIGH);
    }

    public static boolean shouldAlert(RiskLevel level, RiskLevel threshold) {
        return level.isAtLeast(threshold);
    }

    private Optional<String> aiExplanation(Change change, Clause clause, ClauseCategory category) {
        if (assistant == null || clause == null) {
            return Optional.empty();
        }
        try {
            return assistant.explain(
                    clause.getText(),
                    category != null ? category.getKey() : "other",
                    change.getSummary() != null ? change.getSummary() : "")
                .filter(text -> !text.isBlank());
        } catch (Exception e) {
            log.warn("Error generating AI explanation for clause {}: {}", clause.getId(), e.getMessage());
            return Optional.empty();
        }
    }
}
