package com.dcruver.clausedrift.segment;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.ClauseCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.dcruver.clausedrift.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ClauseSegmenterTest {

    private ClauseSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new ClauseSegmenter(new DriftProperties());
    }

    @Test
    void testSplitsOnBlankLines() {
        String text = document(PAYMENT, LIABILITY, JURISDICTION);

        List<Clause> clauses = segmenter.segment("v1", text);

        assertEquals(3, clauses.size());
        assertEquals(PAYMENT, clauses.get(0).getText());
        assertEquals(LIABILITY, clauses.get(1).getText());
        assertEquals(JURISDICTION, clauses.get(2).getText());

        for (int i = 0; i < clauses.size(); i++) {
            Clause clause = clauses.get(i);
            assertEquals(i + 1, clause.getNumber());
            assertEquals("v1#" + (i + 1), clause.getId());
            assertEquals(clause.getText(), text.substring(clause.getSpanStart(), clause.getSpanEnd()));
        }
    }

    @Test
    void testSplitsBeforeNumberedHeadings() {
        String text = "1. " + PAYMENT + "\n2. " + LIABILITY;

        List<Clause> clauses = segmenter.segment("v1", text);

        assertEquals(2, clauses.size());
        assertTrue(clauses.get(0).getText().startsWith("1. Customer"));
        assertTrue(clauses.get(1).getText().startsWith("2. The total liability"));
    }

    @Test
    void testDropsShortFragments() {
        String text = "MASTER SERVICES AGREEMENT\n\n" + PAYMENT + "\n\nPage 1 of 3\n\n" + LIABILITY;

        List<Clause> clauses = segmenter.segment("v1", text);

        assertEquals(2, clauses.size());
        assertEquals(List.of(1, 2), clauses.stream().map(Clause::getNumber).toList());
        assertEquals(PAYMENT, clauses.get(0).getText());
    }

    @Test
    void testEmptyTextYieldsNoClauses() {
        assertTrue(segmenter.segment("v1", "").isEmpty());
        assertTrue(segmenter.segment("v1", "  \n\n  ").isEmpty());
    }

    @Test
    void testNullTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> segmenter.segment("v1", null));
    }

    @Test
    void testClausesAreCategorized() {
        List<Clause> clauses = segmenter.segment("v1", document(PAYMENT, LIABILITY, JURISDICTION, MARKETING));

        assertEquals(ClauseCategory.PAYMENT, clauses.get(0).getCategory());
        assertEquals(ClauseCategory.LIABILITY, clauses.get(1).getCategory());
        assertEquals(ClauseCategory.JURISDICTION, clauses.get(2).getCategory());
        assertEquals(ClauseCategory.MARKETING, clauses.get(3).getCategory());
    }

    @Test
    void testClassifyTieGoesToEarlierCategory() {
        assertEquals(ClauseCategory.LIABILITY, segmenter.classify(null, "liability for data"));
    }

    @Test
    void testClassifyWithoutKeywordsIsUncategorized() {
        assertNull(segmenter.classify(null, "The quick brown fox jumps over the lazy dog."));
        // keywords must start a word
        assertNull(segmenter.classify(null, "an escape route"));
    }

    @Test
    void testClassifyCountsHeading() {
        assertEquals(ClauseCategory.TERMINATION, segmenter.classify("Termination", "Either party may do so."));
    }

    @Test
    void testSectionHintsBecomeClauses() {
        String text = "Payment\n" + PAYMENT + "\n\nLiability\n" + LIABILITY;
        List<SectionHint> hints = List.of(
            SectionHint.of("Payment", PAYMENT),
            SectionHint.of("Liability", LIABILITY));

        List<Clause> clauses = segmenter.segment("v2", text, hints);

        assertEquals(2, clauses.size());
        assertEquals("Payment", clauses.get(0).getHeading());
        assertEquals(PAYMENT, clauses.get(0).getText());
        assertEquals(PAYMENT, text.substring(clauses.get(0).getSpanStart(), clauses.get(0).getSpanEnd()));
        assertEquals(LIABILITY, text.substring(clauses.get(1).getSpanStart(), clauses.get(1).getSpanEnd()));
        assertEquals(ClauseCategory.LIABILITY, clauses.get(1).getCategory());
    }

    @Test
    void testUnlocatableHintGetsBodySpan() {
        List<Clause> clauses = segmenter.segment("v2", "unrelated text",
            List.of(SectionHint.of("Notices", "Notices go to the registered address.")));

        assertEquals(1, clauses.size());
        assertEquals(0, clauses.get(0).getSpanStart());
        assertEquals("Notices go to the registered address.".length(), clauses.get(0).getSpanEnd());
    }

    @Test
    void testMergeLeavesNoShortClauses() {
        List<Clause> clauses = List.of(
            clause(1, 30, null),
            clause(2, 8, "Short"),
            clause(3, 25, null),
            clause(4, 5, null));

        List<Clause> merged = segmenter.mergeShortClauses(clauses, 20);

        assertEquals(2, merged.size());
        assertEquals(30, merged.get(0).getWordCount());
        assertEquals(38, merged.get(1).getWordCount());
        assertEquals("Short", merged.get(1).getHeading());
        assertEquals(List.of(1, 2), merged.stream().map(Clause::getNumber).toList());
        merged.forEach(c -> assertTrue(c.getWordCount() >= 20));
    }

    @Test
    void testMergeKeepsSoleShortClause() {
        List<Clause> merged = segmenter.mergeShortClauses(List.of(clause(1, 5, null)), 20);

        assertEquals(1, merged.size());
        assertEquals(5, merged.get(0).getWordCount());
        assertTrue(segmenter.mergeShortClauses(List.of(), 20).isEmpty());
    }

    private static Clause clause(int number, int words, String heading) {
        String text = IntStream.rangeClosed(1, words)
            .mapToObj(i -> "word" + number + "x" + i)
            .collect(Collectors.joining(" "));
        return Clause.builder()
            .versionId("v1")
            .number(number)
            .heading(heading)
            .text(text)
            .spanStart(number * 1000)
            .spanEnd(number * 1000 + text.length())
            .wordCount(words)
            .build();
    }
}
