package com.incidentlearn.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class PromotionAuditLog {
    private final Path auditLogPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public PromotionAuditLog(Path auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    public synchronized void append(PromotionAuditEntry entry) throws IOException {
        if (auditLogPath.getParent() != null) {
            Files.createDirectories(auditLogPath.getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public long countForcedSince(Instant cutoffInclusive) throws IOException {
        return readAll().stream()
                .filter(entry -> entry.kind() == PromotionAuditEntry.Kind.FORCED)
                .filter(entry -> !entry.timestamp().isBefore(cutoffInclusive))
                .count();
    }

    public List<PromotionAuditEntry> readAll() throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<PromotionAuditEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(auditLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, PromotionAuditEntry.class));
        }
        return entries;
    }
}
