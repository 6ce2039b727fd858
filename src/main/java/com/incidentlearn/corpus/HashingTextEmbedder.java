package com.incidentlearn.corpus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Feature-hashed bag of unigrams and bigrams, L2-normalized. */
public class HashingTextEmbedder implements TextEmbedder {
    private final int dimension;

    public HashingTextEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        List<String> tokens = tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            vector[Math.floorMod(tokens.get(i).hashCode(), dimension)] += 1.0;
            if (i + 1 < tokens.size()) {
                String bigram = tokens.get(i) + "_" + tokens.get(i + 1);
                vector[Math.floorMod(bigram.hashCode(), dimension)] += 0.5;
            }
        }

        double norm = 0;
        for (double v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
