package com.incidentlearn.experiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.storage.FileLocks;

/**
 * Test records as one JSON document, samples as an append-only JSON-lines log that is never pruned. Writers hold
 * {@code ab-tests.json.lock} so a daemon and an operator CLI never overwrite each other's tests.
 */
public class ExperimentStore {
    private static final TypeReference<LinkedHashMap<String, ABTest>> TESTS = new TypeReference<>() {
    };

    private final Path testsPath;
    private final Path samplesPath;
    private final Path lockPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public ExperimentStore(Path directory) {
        this.testsPath = directory.resolve("ab-tests.json");
        this.samplesPath = directory.resolve("ab-samples.jsonl");
        this.lockPath = FileLocks.lockFileFor(testsPath);
    }

    public synchronized Map<String, ABTest> loadTests() throws IOException {
        if (!Files.exists(testsPath) || Files.size(testsPath) == 0L) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(testsPath.toFile(), TESTS);
    }

    public Optional<ABTest> find(String testId) throws IOException {
        return Optional.ofNullable(loadTests().get(testId));
    }

    public void save(ABTest test) throws IOException {
        FileLocks.withLock(lockPath, () -> {
            Map<String, ABTest> tests = loadTests();
            tests.put(test.id(), test);
            write(tests);
            return null;
        });
    }

    /**
     * Builds and stores a new test while holding the store lock, so checks made by {@code factory} against the
     * current tests and the id it picks cannot race another writer.
     */
    public ABTest insert(Function<Map<String, ABTest>, ABTest> factory) throws IOException {
        return FileLocks.withLock(lockPath, () -> {
            Map<String, ABTest> tests = loadTests();
            ABTest test = factory.apply(Map.copyOf(tests));
            if (tests.containsKey(test.id())) {
                throw new IllegalStateException("A/B test id " + test.id() + " is already taken");
            }
            tests.put(test.id(), test);
            write(tests);
            return test;
        });
    }

    public void appendSample(MetricSample sample) throws IOException {
        String line = mapper.writeValueAsString(sample) + System.lineSeparator();
        FileLocks.withLock(FileLocks.lockFileFor(samplesPath), () -> Files.writeString(samplesPath, line,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND));
    }

    public synchronized List<MetricSample> samples(String testId) throws IOException {
        List<MetricSample> samples = new ArrayList<>();
        if (!Files.exists(samplesPath)) {
            return samples;
        }
        try (BufferedReader reader = Files.newBufferedReader(samplesPath)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                MetricSample sample = mapper.readValue(line, MetricSample.class);
                if (sample.testId().equals(testId)) {
                    samples.add(sample);
                }
            }
        }
        return samples;
    }

    private void write(Map<String, ABTest> tests) throws IOException {
        if (testsPath.getParent() != null) {
            Files.createDirectories(testsPath.getParent());
        }
        Path temp = testsPath.resolveSibling(testsPath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), tests);
        Files.move(temp, testsPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
