package com.dcruver.clausedrift.config;

import com.dcruver.clausedrift.domain.RiskLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the comparison pipeline, bound from the {@code drift.*} keys in application.yml.
 */
@ConfigurationProperties(prefix = "drift")
@Data
public class DriftProperties {

    private Segmentation segmentation = new Segmentation();
    private Fingerprint fingerprint = new Fingerprint();
    private Detection detection = new Detection();
    private Risk risk = new Risk();
    private Ai ai = new Ai();
    private Comparison comparison = new Comparison();
    private Reports reports = new Reports();

    @Data
    public static class Segmentation {
        // Fragments with this many words or fewer are noise
        private int noiseWordThreshold = 10;
        private boolean mergeShortClauses = true;
        private int minClauseWords = 20;
    }

    @Data
    public static class Fingerprint {
        private int maxFeatures = 100;
        private int keywordCount = 10;
        private double editHashWeight = 0.3;
        private double vectorWeight = 0.5;
        private double keywordWeight = 0.2;
    }

    @Data
    public static class Detection {
        private double identicalThreshold = 0.95;
        private double modifiedThreshold = 0.6;
        private double rewrittenThreshold = 0.3;
        // Average in AI similarity for ambiguous matches
        private boolean semanticRefinement = false;
        private boolean summarizeChanges = true;
    }

    @Data
    public static class Risk {
        private RiskLevel alertThreshold = RiskLevel.HIGH;
    }

    @Data
    public static class Ai {
        private boolean enabled = false;
        private long minIntervalMs = 4000;
        private long timeoutMs = 30000;
        private int maxPromptChars = 2000;
    }

    @Data
    public static class Comparison {
        private int workerThreads = 4;
    }

    @Data
    public static class Reports {
        private String dir = "${user.home}/.clause-drift/reports";
    }
}
