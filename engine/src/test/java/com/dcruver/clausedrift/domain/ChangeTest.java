package com.dcruver.clausedrift.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChangeTest {

    private static final Clause OLD = Clause.builder().versionId("v1").number(3).text("old").build();
    private static final Clause NEW = Clause.builder().versionId("v2").number(4).text("new").build();

    @Test
    void testClausePresenceMustMatchKind() {
        assertThrows(IllegalArgumentException.class,
            () -> Change.builder().kind(ChangeKind.ADDED).oldClause(OLD).newClause(NEW).build());
        assertThrows(IllegalArgumentException.class,
            () -> Change.builder().kind(ChangeKind.REMOVED).newClause(NEW).build());
        assertThrows(IllegalArgumentException.class,
            () -> Change.builder().kind(ChangeKind.MODIFIED).oldClause(OLD).similarity(0.8).build());
        assertThrows(IllegalArgumentException.class,
            () -> Change.builder().oldClause(OLD).newClause(NEW).build());
    }

    @Test
    void testSimilarityMustBeInRange() {
        assertThrows(IllegalArgumentException.class,
            () -> Change.builder().kind(ChangeKind.MODIFIED).oldClause(OLD).newClause(NEW).similarity(1.2).build());
    }

    @Test
    void testSubjectClausePrefersNewClause() {
        Change modified = Change.builder().kind(ChangeKind.MODIFIED).oldClause(OLD).newClause(NEW).similarity(0.85).build();
        Change removed = Change.builder().kind(ChangeKind.REMOVED).oldClause(OLD).build();

        assertEquals("v2#4", modified.getSubjectClause().getId());
        assertEquals("v1#3", removed.getSubjectClause().getId());
        assertEquals(ChangeMagnitude.MINOR, modified.getMagnitude());
        assertNull(removed.getNewClauseId());
        assertEquals(0, removed.getRiskScore());
        assertNull(removed.getRiskLevel());
    }

    @Test
    void testMagnitudeBands() {
        assertEquals(ChangeMagnitude.MINOR, ChangeMagnitude.of(0.8));
        assertEquals(ChangeMagnitude.MODERATE, ChangeMagnitude.of(0.5));
        assertEquals(ChangeMagnitude.MAJOR, ChangeMagnitude.of(0.49));
    }
}
