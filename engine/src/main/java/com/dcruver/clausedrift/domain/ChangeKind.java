package com.dcruver.clausedrift.domain;

import java.util.Locale;

public enum ChangeKind {
    ADDED,
    REMOVED,
    MODIFIED,
    REWRITTEN;

    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
