package com.incidentlearn.patterns;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class BaselineStore {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public BaselineStore(Path path) {
        this.path = path;
    }

    public synchronized Map<String, Baseline> load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return Map.of();
        }
        return mapper.readValue(path.toFile(), new TypeReference<TreeMap<String, Baseline>>() {
        });
    }

    /** Blends observed statistics into the stored baselines and persists the result. */
    public synchronized Map<String, Baseline> merge(Map<String, Baseline> observed, double smoothing) throws IOException {
        Map<String, Baseline> merged = new TreeMap<>(load());
        observed.forEach((key, value) -> merged.merge(key, value, (current, update) -> current.blend(update, smoothing)));
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), merged);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return merged;
    }
}
