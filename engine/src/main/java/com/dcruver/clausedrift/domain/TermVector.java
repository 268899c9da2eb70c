package com.dcruver.clausedrift.domain;

import lombok.Value;

/**
 * TF-IDF weights of one clause, tagged with the vectorization session that
 * produced them. Vectors from different sessions live in unrelated spaces.
 */
@Value
public class TermVector {
    String sessionId;
    double[] weights;

    public TermVector(String sessionId, double[] weights) {
        this.sessionId = sessionId;
        this.weights = weights.clone();
    }

    /**
     * Copy of the weights; the vector itself never changes
     */
    public double[] getWeights() {
        return weights.clone();
    }

    public boolean isComparableTo(TermVector other) {
        return other != null
            && sessionId.equals(other.sessionId)
            && weights.length == other.weights.length;
    }

    /**
     * Cosine similarity, or 0 when the vectors are not comparable or either is all zeros
     */
    public double cosine(TermVector other) {
        if (!isComparableTo(other)) {
            return 0.0;
        }

        double dot = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;
        for (int i = 0; i < weights.length; i++) {
            dot += weights[i] * other.weights[i];
            norm1 += weights[i] * weights[i];
            norm2 += other.weights[i] * other.weights[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(norm1) * Math.sqrt(norm2));
    }
}
