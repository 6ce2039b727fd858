package com.incidentlearn.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class CycleStateStore {
    private final Path directory;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public CycleStateStore(Path directory) {
        this.directory = directory;
    }

    public synchronized CycleState load(String family) throws IOException {
        Path path = pathFor(family);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            CycleState state = new CycleState();
            state.family = family;
            return state;
        }
        return mapper.readValue(path.toFile(), CycleState.class);
    }

    public synchronized void save(CycleState state) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(state.family);
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path pathFor(String family) {
        return directory.resolve("cycle-state-" + family + ".json");
    }
}
