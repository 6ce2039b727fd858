package com.incidentlearn.retraining;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.training.TrainingExample;

/**
 * The three disjoint slices a candidate was built from: the training portion, the stratified held-out split and
 * the most recent "future" slice kept out of both.
 */
public record DatasetSnapshot(List<TrainingExample> training, List<TrainingExample> holdout, List<TrainingExample> future) {
    private static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    public DatasetSnapshot {
        training = List.copyOf(training);
        holdout = List.copyOf(holdout);
        future = List.copyOf(future);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), this);
    }

    public static DatasetSnapshot load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), DatasetSnapshot.class);
    }

    public String hash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (List<TrainingExample> slice : List.of(training, holdout, future)) {
                for (TrainingExample example : slice) {
                    digest.update(example.id().getBytes(StandardCharsets.UTF_8));
                    digest.update(example.text().getBytes(StandardCharsets.UTF_8));
                    digest.update((byte) (example.label() ? 1 : 0));
                }
                digest.update((byte) '|');
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        }
    }
}
