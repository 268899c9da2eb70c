package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.Fingerprint;
import com.dcruver.clausedrift.domain.FingerprintedClause;
import com.dcruver.clausedrift.domain.RiskLevel;
import com.dcruver.clausedrift.drift.DriftDetector;
import com.dcruver.clausedrift.fingerprint.FingerprintEngine;
import com.dcruver.clausedrift.fingerprint.VectorizationSession;
import com.dcruver.clausedrift.risk.RiskClassifier;
import com.dcruver.clausedrift.segment.ClauseSegmenter;
import com.dcruver.clausedrift.segment.SectionHint;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one comparison end to end: segment, fingerprint, detect, classify, alert.
 *
 * The stages are strictly sequential. Both versions are fingerprinted through a
 * single vectorization session fitted on their joint clause population, so
 * their term vectors share one space; nothing is shared across comparisons.
 */
@Component
@Slf4j
public class ContractDriftPipeline {

    static final String MDC_KEY = "comparison";

    private final ClauseSegmenter segmenter;
    private final FingerprintEngine fingerprintEngine;
    private final DriftDetector driftDetector;
    private final RiskClassifier riskClassifier;
    private final DriftProperties properties;
    private final List<ComparisonResultSink> sinks;

    public ContractDriftPipeline(
            ClauseSegmenter segmenter,
            FingerprintEngine fingerprintEngine,
            DriftDetector driftDetector,
            RiskClassifier riskClassifier,
            DriftProperties properties,
            @Autowired(required = false) List<ComparisonResultSink> sinks) {
        this.segmenter = segmenter;
        this.fingerprintEngine = fingerprintEngine;
        this.driftDetector = driftDetector;
        this.riskClassifier = riskClassifier;
        this.properties = properties;
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
    }

    /**
     * Compare two versions of a contract.
     *
     * @throws IllegalArgumentException if either version has no text
     */
    public ComparisonResult compare(ComparisonRequest request) {
        if (request.getOldText() == null || request.getNewText() == null) {
            throw new IllegalArgumentException("Comparison requires text for both versions");
        }

        String comparisonId = request.getComparisonId() != null
            ? request.getComparisonId() : UUID.randomUUID().toString();
        String previousMdc = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, comparisonId);
        try {
            log.info("Comparing version {} -> {}", request.getOldVersionId(), request.getNewVersionId());

            List<Clause> oldClauses = segment(request.getOldVersionId(), request.getOldText(), request.getOldSections());
            List<Clause> newClauses = segment(request.getNewVersionId(), request.getNewText(), request.getNewSections());
            log.info("Segmented into {} old and {} new clauses", oldClauses.size(), newClauses.size());

            List<String> population = new ArrayList<>();
            oldClauses.forEach(c -> population.add(c.getText()));
            newClauses.forEach(c -> population.add(c.getText()));
            VectorizationSession session = fingerprintEngine.openSession(comparisonId, population);

            List<FingerprintedClause> oldPrints = fingerprint(session, oldClauses);
            List<FingerprintedClause> newPrints = fingerprint(session, newClauses);

            List<Change> changes = driftDetector.detect(oldPrints, newPrints).stream()
                .map(riskClassifier::classify)
                .toList();

            RiskLevel threshold = properties.getRisk().getAlertThreshold();
            List<DriftAlert> alerts = changes.stream()
                .filter(c -> RiskClassifier.shouldAlert(c.getRiskLevel(), threshold))
                .map(c -> DriftAlert.of(comparisonId, c))
                .toList();

            ComparisonResult result = ComparisonResult.builder()
                .comparisonId(comparisonId)
                .oldVersionId(request.getOldVersionId())
                .newVersionId(request.getNewVersionId())
                .success(true)
                .completedAt(Instant.now())
                .oldClauses(oldClauses)
                .newClauses(newClauses)
                .changes(changes)
                .alerts(alerts)
                .stats(ComparisonStats.of(oldClauses.size(), newClauses.size(), changes, alerts.size()))
                .build();

            log.info("Comparison complete: {}", result.getStats());
            publish(result);
            return result;
        } finally {
            if (previousMdc != null) {
                MDC.put(MDC_KEY, previousMdc);
            } else {
                MDC.remove(MDC_KEY);
            }
        }
    }

    private List<Clause> segment(String versionId, String text, List<SectionHint> sections) {
        List<Clause> clauses = segmenter.segment(versionId, text, sections);
        DriftProperties.Segmentation config = properties.getSegmentation();
        if (config.isMergeShortClauses()) {
            clauses = segmenter.mergeShortClauses(clauses, config.getMinClauseWords());
        }
        return clauses;
    }

    private List<FingerprintedClause> fingerprint(VectorizationSession session, List<Clause> clauses) {
        List<Fingerprint> fingerprints = fingerprintEngine.fingerprintBatch(
            session, clauses.stream().map(Clause::getText).toList());

        List<FingerprintedClause> result = new ArrayList<>(clauses.size());
        for (int i = 0; i < clauses.size(); i++) {
            result.add(new FingerprintedClause(clauses.get(i), fingerprints.get(i)));
        }
        return result;
    }

    private void publish(ComparisonResult result) {
        for (ComparisonResultSink sink : sinks) {
            try {
                sink.accept(result);
            } catch (Exception e) {
                log.error("Result sink {} failed for comparison {}",
                    sink.getClass().getSimpleName(), result.getComparisonId(), e);
            }
        }
    }
}
