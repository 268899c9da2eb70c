package com.dcruver.clausedrift.fingerprint;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Fingerprint;
import com.dcruver.clausedrift.domain.TermVector;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes clause fingerprints and scores the similarity of two fingerprints.
 *
 * Similarity combines three signals: SimHash bit agreement, cosine of
 * TF-IDF vectors from a shared {@link VectorizationSession}, and weighted
 * overlap of locally normalized keywords.
 */
@Component
@Slf4j
public class FingerprintEngine {

    public static final int HASH_BITS = 64;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern KEYWORD = Pattern.compile("\\b[a-z]{4,}\\b");

    private static final HashFunction CONTENT_HASH = Hashing.sha256();
    private static final HashFunction TOKEN_HASH = Hashing.murmur3_128();

    private final int maxFeatures;
    private final int keywordCount;
    private final double editHashWeight;
    private final double vectorWeight;
    private final double keywordWeight;

    public FingerprintEngine(DriftProperties properties) {
        DriftProperties.Fingerprint config = properties.getFingerprint();
        this.maxFeatures = config.getMaxFeatures();
        this.keywordCount = config.getKeywordCount();
        this.editHashWeight = config.getEditHashWeight();
        this.vectorWeight = config.getVectorWeight();
        this.keywordWeight = config.getKeywordWeight();
    }

    /**
     * Fingerprint a single clause. No session is involved, so the vector is absent.
     */
    public Fingerprint fingerprint(String text) {
        String normalized = normalize(text);
        return build(text, normalized, null);
    }

    /**
     * Fingerprint a batch of clauses in a session fitted on exactly this batch.
     */
    public List<Fingerprint> fingerprintBatch(String label, List<String> texts) {
        VectorizationSession session = openSession(label, texts);
        return fingerprintBatch(session, texts);
    }

    /**
     * Fit a new vectorization session on a clause population.
     */
    public VectorizationSession openSession(String label, List<String> population) {
        VectorizationSession session = new VectorizationSession(label, maxFeatures);
        session.fit(population.stream().map(FingerprintEngine::normalize).toList());
        return session;
    }

    /**
     * Fingerprint clauses with vectors from the given session.
     *
     * @throws IllegalStateException if the session was never fitted
     */
    public List<Fingerprint> fingerprintBatch(VectorizationSession session, List<String> texts) {
        List<Fingerprint> fingerprints = new ArrayList<>(texts.size());
        for (String text : texts) {
            String normalized = normalize(text);
            fingerprints.add(build(text, normalized, session.transform(normalized)));
        }
        log.debug("Fingerprinted {} clauses in session {}", fingerprints.size(), session.getLabel());
        return fingerprints;
    }

    private Fingerprint build(String raw, String normalized, TermVector vector) {
        return Fingerprint.builder()
            .textHash(CONTENT_HASH.hashString(normalized, StandardCharsets.UTF_8).toString())
            .editHash(simHash(normalized))
            .vector(vector)
            .keywords(extractKeywords(raw))
            .build();
    }

    /**
     * Lowercase, collapse whitespace, drop everything but [a-z0-9] and spaces.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String collapsed = WHITESPACE.matcher(lower).replaceAll(" ");
        return NON_ALPHANUMERIC.matcher(collapsed).replaceAll("").strip();
    }

    /**
     * 64-bit SimHash over whitespace tokens of normalized text.
     * Each token votes +1/-1 on every bit; a bit is set when its vote is positive.
     */
    static long simHash(String normalized) {
        if (normalized.isEmpty()) {
            return 0L;
        }

        int[] votes = new int[HASH_BITS];
        for (String token : WHITESPACE.split(normalized)) {
            long h = TOKEN_HASH.hashString(token, StandardCharsets.UTF_8).asLong();
            for (int bit = 0; bit < HASH_BITS; bit++) {
                votes[bit] += ((h >>> bit) & 1L) != 0 ? 1 : -1;
            }
        }

        long fingerprint = 0L;
        for (int bit = 0; bit < HASH_BITS; bit++) {
            if (votes[bit] > 0) {
                fingerprint |= 1L << bit;
            }
        }
        return fingerprint;
    }

    /**
     * Top-N words of four or more letters, weighted by count / sum of top-N counts.
     * Ties keep first-occurrence order.
     */
    Map<String, Double> extractKeywords(String text) {
        if (text == null) {
            return Map.of();
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = KEYWORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            counts.merge(matcher.group(), 1, Integer::sum);
        }

        List<Map.Entry<String, Integer>> top = counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(keywordCount)
            .toList();

        int total = top.stream().mapToInt(Map.Entry::getValue).sum();
        if (total == 0) {
            return Map.of();
        }

        Map<String, Double> keywords = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : top) {
            keywords.put(entry.getKey(), entry.getValue() / (double) total);
        }
        return Collections.unmodifiableMap(keywords);
    }

    public static int hammingDistance(Fingerprint a, Fingerprint b) {
        return Long.bitCount(a.getEditHash() ^ b.getEditHash());
    }

    /**
     * Weighted similarity in [0, 1]; 1.0 for identical normalized text.
     */
    public double similarity(Fingerprint a, Fingerprint b) {
        if (a.getTextHash().equals(b.getTextHash())) {
            return 1.0;
        }

        double editSimilarity = 1.0 - hammingDistance(a, b) / (double) HASH_BITS;
        double vectorSimilarity = a.hasVector() && b.hasVector()
            ? a.getVector().cosine(b.getVector())
            : 0.0;
        double keywordSimilarity = keywordSimilarity(a.getKeywords(), b.getKeywords());

        double similarity = editHashWeight * editSimilarity
            + vectorWeight * vectorSimilarity
            + keywordWeight * keywordSimilarity;

        return Math.min(1.0, Math.max(0.0, similarity));
    }

    /**
     * Sum of per-term minimum weights over shared terms divided by
     * sum of per-term maximum weights over the union.
     */
    static double keywordSimilarity(Map<String, Double> kw1, Map<String, Double> kw2) {
        if (kw1 == null || kw2 == null || kw1.isEmpty() || kw2.isEmpty()) {
            return 0.0;
        }

        // sorted so both argument orders sum in the same sequence
        Set<String> union = new TreeSet<>(kw1.keySet());
        union.addAll(kw2.keySet());

        double overlap = 0.0;
        double total = 0.0;
        for (String term : union) {
            double w1 = kw1.getOrDefault(term, 0.0);
            double w2 = kw2.getOrDefault(term, 0.0);
            overlap += Math.min(w1, w2);
            total += Math.max(w1, w2);
        }
        return total > 0 ? overlap / total : 0.0;
    }
}
