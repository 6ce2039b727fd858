package com.incidentlearn.validation;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** One immutable report file per model version. */
public class ValidationReportStore {
    private final Path directory;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public ValidationReportStore(Path directory) {
        this.directory = directory;
    }

    public Path save(ValidationReport report) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(report.modelVersionId());
        try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, report);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Validation report for model " + report.modelVersionId() + " already written", e);
        }
        return path;
    }

    public Optional<ValidationReport> load(long modelVersionId) throws IOException {
        Path path = pathFor(modelVersionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(path.toFile(), ValidationReport.class));
    }

    private Path pathFor(long modelVersionId) {
        return directory.resolve("report-" + modelVersionId + ".json");
    }
}
