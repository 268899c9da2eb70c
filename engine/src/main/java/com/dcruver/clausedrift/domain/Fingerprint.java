package com.dcruver.clausedrift.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Multi-signal representation of one clause used for similarity scoring.
 */
@Value
@Builder
public class Fingerprint {
    String textHash;              // SHA-256 of normalized text
    long editHash;                // 64-bit SimHash
    TermVector vector;            // null outside a vectorization session
    Map<String, Double> keywords; // term -> locally normalized weight

    public boolean hasVector() {
        return vector != null;
    }

    public String getEditHashHex() {
        return Long.toHexString(editHash);
    }
}
