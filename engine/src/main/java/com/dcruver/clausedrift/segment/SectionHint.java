package com.dcruver.clausedrift.segment;

import lombok.Value;

/**
 * A (heading, body) pair detected upstream by the text extractor.
 */
@Value
public class SectionHint {
    String heading;
    String body;

    public static SectionHint of(String heading, String body) {
        return new SectionHint(heading, body);
    }
}
