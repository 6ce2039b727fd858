package com.incidentlearn.corpus;

public interface TextEmbedder {
    double[] embed(String text);

    int dimension();

    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Cosine distance in [0, 2]. */
    static double distance(double[] a, double[] b) {
        return 1.0 - cosine(a, b);
    }

    static double[] centroid(Iterable<double[]> vectors, int dimension) {
        double[] sum = new double[dimension];
        int count = 0;
        for (double[] vector : vectors) {
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
            count++;
        }
        if (count > 0) {
            for (int i = 0; i < dimension; i++) {
                sum[i] /= count;
            }
        }
        return sum;
    }
}
