package com.dcruver.clausedrift.domain;

import lombok.Value;

/**
 * A clause paired with the fingerprint computed for it.
 */
@Value
public class FingerprintedClause {
    Clause clause;
    Fingerprint fingerprint;

    public String getId() {
        return clause.getId();
    }
}
