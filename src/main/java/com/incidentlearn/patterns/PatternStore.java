package com.incidentlearn.patterns;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** Append-only pattern log. Appending assigns an id and links the previous pattern for the same kind and subject. */
public class PatternStore {
    private final Path logPath;
    private final List<Pattern> patterns = new ArrayList<>();
    private final Map<String, String> latestBySubject = new HashMap<>();
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public PatternStore(Path logPath) throws IOException {
        this.logPath = logPath;
        if (Files.exists(logPath)) {
            for (String line : Files.readAllLines(logPath)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                Pattern pattern = mapper.readValue(line, Pattern.class);
                patterns.add(pattern);
                latestBySubject.put(lineageKey(pattern), pattern.id());
            }
        }
    }

    public synchronized List<Pattern> appendAll(List<Pattern> detected) throws IOException {
        List<Pattern> stored = new ArrayList<>();
        StringBuilder lines = new StringBuilder();
        for (Pattern pattern : detected) {
            String id = pattern.kind().name().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + (patterns.size() + stored.size() + 1);
            Pattern linked = pattern.withLineage(id, latestBySubject.get(lineageKey(pattern)));
            latestBySubject.put(lineageKey(linked), id);
            stored.add(linked);
            lines.append(mapper.writeValueAsString(linked)).append(System.lineSeparator());
        }
        if (stored.isEmpty()) {
            return stored;
        }
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        Files.writeString(logPath, lines.toString(), StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        patterns.addAll(stored);
        return stored;
    }

    public synchronized List<Pattern> all() {
        return List.copyOf(patterns);
    }

    /** Every pattern ever recorded for a kind and subject, oldest first. */
    public synchronized List<Pattern> history(PatternKind kind, String subject) {
        return patterns.stream().filter(pattern -> pattern.kind() == kind && pattern.subject().equals(subject)).toList();
    }

    private static String lineageKey(Pattern pattern) {
        return pattern.kind() + "|" + pattern.subject();
    }
}
