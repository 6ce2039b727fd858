package com.incidentlearn.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.feedback.TimeWindow;

/** Incident corpus snapshot kept in a JSON-lines file, one observation per line. */
public class JsonIncidentCorpus implements IncidentCorpus {
    private final Path path;
    private final Map<String, IncidentObservation> byId = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public JsonIncidentCorpus(Path path) throws IOException {
        this.path = path;
        if (Files.exists(path)) {
            for (String line : Files.readAllLines(path)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                IncidentObservation observation = mapper.readValue(line, IncidentObservation.class);
                byId.put(observation.incidentId(), observation);
            }
        }
    }

    public synchronized void add(IncidentObservation observation) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, mapper.writeValueAsString(observation) + System.lineSeparator(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        byId.put(observation.incidentId(), observation);
    }

    /** Appends every observation from another JSON-lines file and returns how many were read. */
    public int importFrom(Path source) throws IOException {
        int imported = 0;
        for (String line : Files.readAllLines(source)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            add(mapper.readValue(line, IncidentObservation.class));
            imported++;
        }
        return imported;
    }

    @Override
    public List<IncidentObservation> between(TimeWindow window) {
        List<IncidentObservation> matched = new ArrayList<>();
        for (IncidentObservation observation : byId.values()) {
            if (window.contains(observation.occurredAt())) {
                matched.add(observation);
            }
        }
        matched.sort(Comparator.comparing(IncidentObservation::occurredAt).thenComparing(IncidentObservation::incidentId));
        return matched;
    }

    @Override
    public Optional<IncidentObservation> find(String incidentId) {
        return Optional.ofNullable(byId.get(incidentId));
    }

    public int size() {
        return byId.size();
    }
}
