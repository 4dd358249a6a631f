package com.support.triage.spring_server.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Term-frequency / inverse-document-frequency vectorizer over word n-grams.
 * <p>
 * Tokens are lowercase runs of at least two word characters; stop words are dropped before
 * n-grams are built. The vocabulary keeps the {@code maxFeatures} terms with the highest
 * corpus frequency (ties broken alphabetically). Idf is smoothed, {@code ln((1+n)/(1+df)) + 1},
 * and every document vector is L2-normalised, so cosine similarity is a plain dot product.
 * <p>
 * Instances are not thread-safe: {@link #fitTransform(List)} rebuilds the vocabulary.
 */
public class TfIdfVectorizer {
    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxFeatures;
    private final int minNgram;
    private final int maxNgram;
    private final Set<String> stopWords;

    private Map<String, Integer> vocabulary = Map.of();
    private double[] idf = new double[0];

    public TfIdfVectorizer(int maxFeatures, int minNgram, int maxNgram, Set<String> stopWords) {
        if (maxFeatures <= 0 || minNgram <= 0 || maxNgram < minNgram) {
            throw new IllegalArgumentException("Invalid vectorizer settings: maxFeatures=" + maxFeatures
                    + ", ngram=(" + minNgram + "," + maxNgram + ")");
        }
        this.maxFeatures = maxFeatures;
        this.minNgram = minNgram;
        this.maxNgram = maxNgram;
        this.stopWords = stopWords == null ? Set.of() : stopWords;
    }

    /**
     * Learns vocabulary and idf from {@code documents} and returns one vector per document,
     * in input order.
     */
    public List<SparseVector> fitTransform(List<String> documents) {
        List<Map<String, Integer>> counts = new ArrayList<>(documents.size());
        Map<String, Long> corpusFrequency = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (String document : documents) {
            Map<String, Integer> termCounts = countTerms(document);
            counts.add(termCounts);
            for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
                corpusFrequency.merge(entry.getKey(), entry.getValue().longValue(), Long::sum);
                documentFrequency.merge(entry.getKey(), 1, Integer::sum);
            }
        }

        List<String> terms = new ArrayList<>(corpusFrequency.keySet());
        terms.sort(Comparator.<String>comparingLong(corpusFrequency::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
        if (terms.size() > maxFeatures) {
            terms = terms.subList(0, maxFeatures);
        }
        terms.sort(Comparator.naturalOrder());

        Map<String, Integer> vocab = new HashMap<>();
        double[] weights = new double[terms.size()];
        int n = documents.size();
        for (int i = 0; i < terms.size(); i++) {
            String term = terms.get(i);
            vocab.put(term, i);
            weights[i] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
        }
        this.vocabulary = vocab;
        this.idf = weights;

        List<SparseVector> vectors = new ArrayList<>(counts.size());
        for (Map<String, Integer> termCounts : counts) {
            vectors.add(toVector(termCounts));
        }
        return vectors;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    public Set<String> vocabulary() {
        return new HashSet<>(vocabulary.keySet());
    }

    List<String> analyze(String document) {
        List<String> tokens = new ArrayList<>();
        if (document == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (!stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        List<String> grams = new ArrayList<>();
        for (int size = minNgram; size <= maxNgram; size++) {
            for (int start = 0; start + size <= tokens.size(); start++) {
                grams.add(String.join(" ", tokens.subList(start, start + size)));
            }
        }
        return grams;
    }

    private Map<String, Integer> countTerms(String document) {
        Map<String, Integer> termCounts = new HashMap<>();
        for (String gram : analyze(document)) {
            termCounts.merge(gram, 1, Integer::sum);
        }
        return termCounts;
    }

    private SparseVector toVector(Map<String, Integer> termCounts) {
        TreeMap<Integer, Double> weighted = new TreeMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            Integer index = vocabulary.get(entry.getKey());
            if (index == null) {
                continue;
            }
            double weight = entry.getValue() * idf[index];
            weighted.put(index, weight);
            norm += weight * weight;
        }
        int[] indices = new int[weighted.size()];
        double[] values = new double[weighted.size()];
        double length = Math.sqrt(norm);
        int i = 0;
        for (Map.Entry<Integer, Double> entry : weighted.entrySet()) {
            indices[i] = entry.getKey();
            values[i] = length == 0.0 ? 0.0 : entry.getValue() / length;
            i++;
        }
        return new SparseVector(indices, values);
    }

    /**
     * Cosine similarity of two L2-normalised vectors, clamped to [0, 1].
     */
    public static double cosine(SparseVector a, SparseVector b) {
        double dot = a.dot(b);
        if (dot <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, dot);
    }

    /**
     * Sparse vector with strictly increasing indices.
     */
    public static final class SparseVector {
        private final int[] indices;
        private final double[] values;

        public SparseVector(int[] indices, double[] values) {
            if (indices.length != values.length) {
                throw new IllegalArgumentException("indices and values differ in length");
            }
            this.indices = indices;
            this.values = values;
        }

        public double dot(SparseVector other) {
            double sum = 0.0;
            int i = 0;
            int j = 0;
            while (i < indices.length && j < other.indices.length) {
                if (indices[i] == other.indices[j]) {
                    sum += values[i] * other.values[j];
                    i++;
                    j++;
                } else if (indices[i] < other.indices[j]) {
                    i++;
                } else {
                    j++;
                }
            }
            return sum;
        }

        public int nonZeroCount() {
            return indices.length;
        }

        public boolean isEmpty() {
            return indices.length == 0;
        }

        @Override
        public String toString() {
            return "SparseVector" + Arrays.toString(indices);
        }
    }
}
