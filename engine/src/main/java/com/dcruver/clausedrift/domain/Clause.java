package com.dcruver.clausedrift.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A contiguous span of contract text treated as the atomic comparison unit.
 * Identity is (versionId, number); instances are never mutated.
 */
@Value
@Builder(toBuilder = true)
@With
public class Clause {
    String versionId;
    int number;            // 1-based, unique within one version
    String heading;        // may be null
    ClauseCategory category;  // null when uncategorized
    String text;
    int spanStart;         // inclusive
    int spanEnd;           // exclusive
    int wordCount;

    public String getId() {
        return versionId + "#" + number;
    }

    public String getCategoryKey() {
        return category != null ? category.getKey() : null;
    }

    public boolean hasHeading() {
        return heading != null && !heading.isBlank();
    }
}
