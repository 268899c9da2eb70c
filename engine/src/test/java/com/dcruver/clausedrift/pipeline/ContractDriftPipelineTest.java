package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.domain.ChangeKind;
import com.dcruver.clausedrift.domain.ClauseCategory;
import com.dcruver.clausedrift.domain.RiskLevel;
import com.dcruver.clausedrift.drift.ClauseDiffer;
import com.dcruver.clausedrift.drift.DriftDetector;
import com.dcruver.clausedrift.fingerprint.FingerprintEngine;
import com.dcruver.clausedrift.risk.RiskClassifier;
import com.dcruver.clausedrift.segment.ClauseSegmenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static com.dcruver.clausedrift.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContractDriftPipelineTest {

    private DriftProperties properties;
    private List<ComparisonResult> published;
    private ContractDriftPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new DriftProperties();
        published = new ArrayList<>();
        pipeline = pipeline(List.of(
            result -> {
                throw new IllegalStateException("sink offline");
            },
            published::add));
    }

    @Test
    void testIdenticalVersionsProduceNoChanges() {
        String text = document(PAYMENT, LIABILITY, JURISDICTION);

        ComparisonResult result = pipeline.compare(request("same", text, text));

        assertTrue(result.isSuccess());
        assertEquals("same", result.getComparisonId());
        assertTrue(result.getChanges().isEmpty());
        assertTrue(result.getAlerts().isEmpty());
        assertEquals(3, result.getStats().getOldClauses());
        assertEquals(3, result.getStats().getNewClauses());
        assertEquals(0, result.getStats().getChangesDetected());
    }

    @Test
    void testRemovedLiabilityClauseRaisesAlert() {
        ComparisonResult result = pipeline.compare(request("removal",
            document(PAYMENT, LIABILITY, JURISDICTION),
            document(PAYMENT, JURISDICTION)));

        assertEquals(1, result.getChanges().size());
        Change change = result.getChanges().get(0);
        assertEquals(ChangeKind.REMOVED, change.getKind());
        assertEquals(ClauseCategory.LIABILITY, change.getOldClause().getCategory());
        assertEquals(RiskLevel.CRITICAL, change.getRiskLevel());
        assertEquals(100, change.getRiskScore());
        assertNotNull(change.getExplanation());

        assertEquals(1, result.getAlerts().size());
        DriftAlert alert = result.getAlerts().get(0);
        assertEquals("removal", alert.getComparisonId());
        assertEquals(RiskLevel.CRITICAL, alert.getLevel());
        assertTrue(alert.getMessage().contains("old#2"));

        ComparisonStats stats = result.getStats();
        assertEquals(1, stats.getChangesDetected());
        assertEquals(1, stats.getHighRiskChanges());
        assertEquals(1, stats.getAlertsCreated());
        assertEquals(1, stats.getChangesByKind().get(ChangeKind.REMOVED));
        assertEquals(0, stats.getChangesByKind().get(ChangeKind.ADDED));
    }

    @Test
    void testAddedMarketingClauseIsBelowAlertThreshold() {
        ComparisonResult result = pipeline.compare(request("addition",
            document(PAYMENT, JURISDICTION),
            document(PAYMENT, JURISDICTION, MARKETING)));

        assertEquals(1, result.getChanges().size());
        Change change = result.getChanges().get(0);
        assertEquals(ChangeKind.ADDED, change.getKind());
        assertEquals(RiskLevel.LOW, change.getRiskLevel());
        assertEquals(22, change.getRiskScore());
        assertTrue(result.getAlerts().isEmpty());
    }

    @Test
    void testLowerThresholdAlertsMore() {
        properties.getRisk().setAlertThreshold(RiskLevel.LOW);

        ComparisonResult result = pipeline.compare(request("addition",
            document(PAYMENT, JURISDICTION),
            document(PAYMENT, JURISDICTION, MARKETING)));

        assertEquals(1, result.getAlerts().size());
    }

    @Test
    void testNumeralEditIsModifiedEndToEnd() {
        ComparisonResult result = pipeline.compare(request("fee", FEE_OLD, FEE_NEW));

        assertEquals(1, result.getChanges().size());
        Change change = result.getChanges().get(0);
        assertEquals(ChangeKind.MODIFIED, change.getKind());
        assertEquals(ClauseCategory.PAYMENT, change.getNewClause().getCategory());
        assertFalse(change.getDiff().getUnifiedDiff().isEmpty());
    }

    @Test
    void testResultsReachSinksDespiteFailingSink() {
        pipeline.compare(request("sinks", PAYMENT, PAYMENT));

        assertEquals(1, published.size());
        assertEquals("sinks", published.get(0).getComparisonId());
    }

    @Test
    void testComparisonIdIsScopedToMdc() {
        MDC.remove(ContractDriftPipeline.MDC_KEY);
        List<String> seen = new ArrayList<>();
        ContractDriftPipeline capturing = pipeline(List.of(r -> seen.add(MDC.get(ContractDriftPipeline.MDC_KEY))));

        capturing.compare(request("mdc", PAYMENT, LIABILITY));

        assertEquals(List.of("mdc"), seen);
        assertNull(MDC.get(ContractDriftPipeline.MDC_KEY));
    }

    @Test
    void testGeneratedIdWhenRequestHasNone() {
        ComparisonResult result = pipeline.compare(request(null, PAYMENT, PAYMENT));

        assertNotNull(result.getComparisonId());
        assertFalse(result.getComparisonId().isBlank());
    }

    @Test
    void testMissingTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.compare(request("bad", null, PAYMENT)));
    }

    private ContractDriftPipeline pipeline(List<ComparisonResultSink> sinks) {
        FingerprintEngine engine = new FingerprintEngine(properties);
        return new ContractDriftPipeline(
            new ClauseSegmenter(properties),
            engine,
            new DriftDetector(engine, new ClauseDiffer(), properties, null),
            new RiskClassifier(null),
            properties,
            sinks);
    }

    static ComparisonRequest request(String id, String oldText, String newText) {
        return ComparisonRequest.builder()
            .comparisonId(id)
            .oldVersionId("old")
            .oldText(oldText)
            .newVersionId("new")
            .newText(newText)
            .build();
    }
}
