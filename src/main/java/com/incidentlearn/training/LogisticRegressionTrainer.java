package com.incidentlearn.training;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.corpus.HashingTextEmbedder;

/** Mini-batch SGD logistic regression over hashed text features. Deterministic for a given seed. */
public class LogisticRegressionTrainer implements ModelTrainer {
    static final String FORMAT = "logistic-hashing-v1";
    static final String ARTIFACT_FILE = "model.json";

    private final int dimension;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public LogisticRegressionTrainer() {
        this(512);
    }

    public LogisticRegressionTrainer(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return "logistic-regression";
    }

    @Override
    public TrainingResult train(List<TrainingExample> dataset, TrainingHyperparameters hyperparameters, Path runDirectory) throws IOException {
        if (dataset.isEmpty()) {
            throw new IllegalArgumentException("cannot train on an empty dataset");
        }
        HashingTextEmbedder embedder = new HashingTextEmbedder(dimension);
        List<double[]> features = new ArrayList<>(dataset.size());
        for (TrainingExample example : dataset) {
            features.add(embedder.embed(example.text()));
        }

        double[] weights = new double[dimension];
        double bias = 0.0;
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < dataset.size(); i++) {
            order.add(i);
        }
        Random random = new Random(hyperparameters.seed());
        for (int epoch = 0; epoch < hyperparameters.epochs(); epoch++) {
            Collections.shuffle(order, random);
            for (int batchStart = 0; batchStart < order.size(); batchStart += hyperparameters.batchSize()) {
                int batchEnd = Math.min(order.size(), batchStart + hyperparameters.batchSize());
                double[] gradient = new double[dimension];
                double biasGradient = 0.0;
                for (int k = batchStart; k < batchEnd; k++) {
                    int index = order.get(k);
                    double[] x = features.get(index);
                    double error = sigmoid(dot(weights, x) + bias) - (dataset.get(index).label() ? 1.0 : 0.0);
                    for (int d = 0; d < dimension; d++) {
                        gradient[d] += error * x[d];
                    }
                    biasGradient += error;
                }
                int batchSize = batchEnd - batchStart;
                for (int d = 0; d < dimension; d++) {
                    weights[d] -= hyperparameters.learningRate() * (gradient[d] / batchSize + hyperparameters.l2() * weights[d]);
                }
                bias -= hyperparameters.learningRate() * biasGradient / batchSize;
            }
        }

        Files.createDirectories(runDirectory);
        Path artifactPath = runDirectory.resolve(ARTIFACT_FILE);
        ModelArtifact artifact = new ModelArtifact(FORMAT, dimension, weights, bias, checksum(weights, bias));
        mapper.writerWithDefaultPrettyPrinter().writeValue(artifactPath.toFile(), artifact);
        String notes = "Trained on " + dataset.size() + " examples for " + hyperparameters.epochs() + " epochs";
        return new TrainingResult(new LogisticModel(embedder, weights, bias), artifactPath, name(), notes);
    }

    @Override
    public TrainedModel load(Path artifactPath) throws IOException {
        if (artifactPath == null || !Files.isRegularFile(artifactPath)) {
            throw new CorruptArtifactException("Model artifact is missing: " + artifactPath);
        }
        ModelArtifact artifact;
        try {
            artifact = mapper.readValue(artifactPath.toFile(), ModelArtifact.class);
        } catch (JsonProcessingException e) {
            throw new CorruptArtifactException("Model artifact is not readable: " + artifactPath, e);
        }
        if (!FORMAT.equals(artifact.format())) {
            throw new CorruptArtifactException("Unsupported artifact format " + artifact.format() + " in " + artifactPath);
        }
        if (artifact.weights() == null || artifact.weights().length != artifact.dimension()) {
            throw new CorruptArtifactException("Artifact weight vector does not match its dimension in " + artifactPath);
        }
        if (!checksum(artifact.weights(), artifact.bias()).equals(artifact.checksum())) {
            throw new CorruptArtifactException("Artifact checksum mismatch in " + artifactPath);
        }
        return new LogisticModel(new HashingTextEmbedder(artifact.dimension()), artifact.weights(), artifact.bias());
    }

    private static String checksum(double[] weights, double bias) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES * (weights.length + 1));
            for (double weight : weights) {
                buffer.putDouble(weight);
            }
            buffer.putDouble(bias);
            digest.update(buffer.array());
            digest.update(FORMAT.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    record ModelArtifact(String format, int dimension, double[] weights, double bias, String checksum) {
    }

    private static final class LogisticModel implements TrainedModel {
        private final HashingTextEmbedder embedder;
        private final double[] weights;
        private final double bias;

        private LogisticModel(HashingTextEmbedder embedder, double[] weights, double bias) {
            this.embedder = embedder;
            this.weights = weights.clone();
            this.bias = bias;
        }

        @Override
        public double score(TrainingExample example) {
            return sigmoid(dot(weights, embedder.embed(example.text())) + bias);
        }
    }
}
