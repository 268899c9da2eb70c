package com.dcruver.clausedrift.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed clause taxonomy. Declaration order is significant: it breaks ties
 * when a clause scores equally against several categories.
 */
public enum ClauseCategory {
    LIABILITY("liability", List.of(
        "liability", "indemnification", "damages", "limitation of liability",
        "warranty", "warranties", "disclaimer", "limitation", "cap")),
    DATA_USAGE("data_usage", List.of(
        "data", "privacy", "personal information", "data processing",
        "data protection", "gdpr", "ccpa", "confidential", "confidentiality")),
    TERMINATION("termination", List.of(
        "termination", "terminate", "cancellation", "cancel", "end",
        "expiration", "expire", "renewal", "term")),
    JURISDICTION("jurisdiction", List.of(
        "jurisdiction", "governing law", "venue", "arbitration",
        "dispute resolution", "legal", "court", "forum")),
    PAYMENT("payment", List.of(
        "payment", "fees", "pricing", "billing", "subscription",
        "refund", "charge", "cost", "price")),
    INTELLECTUAL_PROPERTY("intellectual_property", List.of(
        "intellectual property", "copyright", "trademark", "patent",
        "ip", "proprietary", "ownership", "license")),
    SERVICE_LEVEL("service_level", List.of(
        "sla", "service level", "uptime", "availability", "performance",
        "guarantee", "commitment")),
    MARKETING("marketing", List.of(
        "marketing", "promotional", "communication", "newsletter",
        "advertising", "email"));

    private final String key;
    private final List<String> keywords;

    ClauseCategory(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String getKey() {
        return key;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * Human-readable name, e.g. "data usage" for DATA_USAGE
     */
    public String getDisplayName() {
        return key.replace('_', ' ');
    }

    public static Optional<ClauseCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(c -> c.key.equalsIgnoreCase(key.trim()))
            .findFirst();
    }
}
