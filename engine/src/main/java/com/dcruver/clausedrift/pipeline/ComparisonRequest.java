package com.dcruver.clausedrift.pipeline;

import com.dcruver.clausedrift.segment.SectionHint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Two consecutive versions of one contract to compare. Section hints are optional.
 */
@Value
@Builder
public class ComparisonRequest {
    String comparisonId;
    String oldVersionId;
    String oldText;
    List<SectionHint> oldSections;
    String newVersionId;
    String newText;
    List<SectionHint> newSections;
}
