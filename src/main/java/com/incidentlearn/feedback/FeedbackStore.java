package com.incidentlearn.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.storage.FileLocks;

/**
 * JSON-lines log of accepted feedback plus an archive log for expired records. Every access holds
 * {@code feedback.jsonl.lock}, so records appended by an ingest run in another process are neither missed nor
 * overwritten when the log is archived.
 */
public class FeedbackStore {
    private final Path logPath;
    private final Path archivePath;
    private final Path lockPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public FeedbackStore(Path directory) {
        this(directory.resolve("feedback.jsonl"), directory.resolve("feedback-archive.jsonl"));
    }

    public FeedbackStore(Path logPath, Path archivePath) {
        this.logPath = logPath;
        this.archivePath = archivePath;
        this.lockPath = FileLocks.lockFileFor(logPath);
    }

    public void append(FeedbackRecord record) throws IOException {
        FileLocks.withLock(lockPath, () -> {
            appendAll(logPath, List.of(mapper.writeValueAsString(record)));
            return null;
        });
    }

    public List<FeedbackRecord> loadAll() throws IOException {
        return FileLocks.withLock(lockPath, () -> read(logPath));
    }

    public List<FeedbackRecord> loadArchive() throws IOException {
        return FileLocks.withLock(lockPath, () -> read(archivePath));
    }

    /**
     * Moves every logged record stamped before {@code cutoff} to the archive, superseded duplicates included, and
     * returns the moved records. Lines are moved verbatim; the live log keeps the rest in their original order.
     */
    public List<FeedbackRecord> archiveBefore(Instant cutoff) throws IOException {
        return FileLocks.withLock(lockPath, () -> {
            if (!Files.exists(logPath)) {
                return List.of();
            }
            List<FeedbackRecord> expired = new ArrayList<>();
            List<String> expiredLines = new ArrayList<>();
            List<String> retainedLines = new ArrayList<>();
            for (String line : Files.readAllLines(logPath)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                FeedbackRecord record = mapper.readValue(line, FeedbackRecord.class);
                if (record.recordedAt().isBefore(cutoff)) {
                    expired.add(record);
                    expiredLines.add(line);
                } else {
                    retainedLines.add(line);
                }
            }
            if (expired.isEmpty()) {
                return List.of();
            }
            appendAll(archivePath, expiredLines);
            Path temp = logPath.resolveSibling(logPath.getFileName() + ".tmp");
            Files.writeString(temp, joinLines(retainedLines));
            Files.move(temp, logPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return expired;
        });
    }

    private static Path withParentDirs(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        return path;
    }

    private static void appendAll(Path path, List<String> lines) throws IOException {
        if (lines.isEmpty()) {
            return;
        }
        Files.writeString(withParentDirs(path), joinLines(lines), StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private static String joinLines(List<String> lines) {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append(System.lineSeparator());
        }
        return content.toString();
    }

    private List<FeedbackRecord> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<FeedbackRecord> records = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            records.add(mapper.readValue(line, FeedbackRecord.class));
        }
        return records;
    }
}
