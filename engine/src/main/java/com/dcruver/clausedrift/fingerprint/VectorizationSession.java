package com.dcruver.clausedrift.fingerprint;

import com.dcruver.clausedrift.domain.TermVector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared TF-IDF vocabulary for one batch of clauses.
 *
 * A session is fitted exactly once on a clause population and then turns
 * texts into vectors in that vocabulary's space. Vectors are tagged with the
 * session id, so vectors of different sessions are never treated as comparable.
 */
@Slf4j
public class VectorizationSession {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b");

    @Getter
    private final String id;
    @Getter
    private final String label;
    private final int maxFeatures;

    private Map<String, Integer> vocabulary;
    private double[] idf;

    VectorizationSession(String label, int maxFeatures) {
        this.id = UUID.randomUUID().toString();
        this.label = label;
        this.maxFeatures = maxFeatures;
    }

    /**
     * Fit the vocabulary and inverse document frequencies on normalized texts.
     *
     * @throws IllegalStateException if the session was already fitted
     */
    synchronized void fit(Collection<String> normalizedTexts) {
        if (vocabulary != null) {
            throw new IllegalStateException("Vectorization session " + label + " is already fitted");
        }

        Map<String, Integer> termCounts = new HashMap<>();
        Map<String, Integer> docFrequency = new HashMap<>();
        for (String text : normalizedTexts) {
            List<String> terms = terms(text);
            for (String term : terms) {
                termCounts.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                docFrequency.merge(term, 1, Integer::sum);
            }
        }

        // Keep the most frequent terms, then index them alphabetically
        List<String> kept = termCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(maxFeatures)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();

        Map<String, Integer> index = new TreeMap<>();
        double[] weights = new double[kept.size()];
        int documents = normalizedTexts.size();
        for (int i = 0; i < kept.size(); i++) {
            String term = kept.get(i);
            index.put(term, i);
            weights[i] = Math.log((1.0 + documents) / (1.0 + docFrequency.get(term))) + 1.0;
        }

        this.vocabulary = index;
        this.idf = weights;

        if (vocabulary.isEmpty()) {
            log.debug("Session {} has an empty vocabulary; vectors will be absent", label);
        } else {
            log.debug("Session {} fitted on {} texts with {} terms", label, documents, vocabulary.size());
        }
    }

    public boolean isFitted() {
        return vocabulary != null;
    }

    public int getVocabularySize() {
        return vocabulary != null ? vocabulary.size() : 0;
    }

    /**
     * L2-normalized TF-IDF vector of a normalized text.
     *
     * @return the vector, or null when the vocabulary is empty
     * @throws IllegalStateException if the session was never fitted
     */
    TermVector transform(String normalizedText) {
        if (vocabulary == null) {
            throw new IllegalStateException("Vectorization session " + label + " has not been fitted");
        }
        if (vocabulary.isEmpty()) {
            return null;
        }

        double[] weights = new double[vocabulary.size()];
        for (String term : terms(normalizedText)) {
            Integer column = vocabulary.get(term);
            if (column != null) {
                weights[column] += 1.0;
            }
        }

        double norm = 0.0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] *= idf[i];
            norm += weights[i] * weights[i];
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < weights.length; i++) {
                weights[i] /= norm;
            }
        }
        return new TermVector(id, weights);
    }

    /**
     * Unigrams and bigrams after stopword removal
     */
    static List<String> terms(String normalizedText) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(normalizedText);
        while (matcher.find()) {
            String token = matcher.group();
            if (!EnglishStopWords.contains(token)) {
                tokens.add(token);
            }
        }

        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }
}
