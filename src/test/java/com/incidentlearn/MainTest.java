package com.incidentlearn;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.runtime.AppConfig;
import com.incidentlearn.runtime.LearningPipeline;

import okhttp3.OkHttpClient;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldNormalizeHyphenatedModes() {
        assertArrayEquals(new String[] { "--mode", "abort_test", "--reason", "roll-back" },
                Main.normalizeModes(new String[] { "--mode", "abort-test", "--reason", "roll-back" }));
        assertArrayEquals(new String[] { "--mode=force_promote" }, Main.normalizeModes(new String[] { "--mode=force-promote" }));
    }

    @Test
    void shouldRejectForcePromoteWithoutReason() throws Exception {
        assertEquals(2, execute("--config", writeConfig().toString(), "--mode", "force-promote", "--model-id", "3"));
        assertEquals(2, execute("--config", writeConfig().toString(), "--mode", "abort-test"));
    }

    @Test
    void shouldRejectUnknownFamily() throws Exception {
        assertEquals(2, execute("--config", writeConfig().toString(), "--mode", "status", "--family", "billing"));
    }

    @Test
    void shouldReportStatusOnEmptyState() throws Exception {
        assertEquals(0, execute("--config", writeConfig().toString(), "--mode", "status"));
    }

    @Test
    void shouldIngestEventsAndExportMetrics() throws Exception {
        Path config = writeConfig();
        Path events = tempDir.resolve("events.jsonl");
        Files.writeString(events, String.join("\n",
                "{\"incident_id\":\"INC-1\",\"source\":\"operator\",\"outcome\":\"success\",\"rating\":5}",
                "{\"incident_id\":\"INC-2\",\"source\":\"user\",\"outcome\":\"failure\",\"rating\":2}"));
        Path export = tempDir.resolve("out").resolve("metrics.csv");

        assertEquals(0, execute("--config", config.toString(), "--mode", "ingest", "--events", events.toString()));
        assertEquals(0, execute("--config", config.toString(), "--mode", "export-metrics", "--format", "csv", "--output", export.toString()));

        AppConfig reloaded = new AppConfig();
        reloaded.getStorage().setStateDir(tempDir.resolve("state").toString());
        reloaded.getStorage().setCorpusPath(tempDir.resolve("state").resolve("incidents.json").toString());
        try (LearningPipeline pipeline = new LearningPipeline(reloaded, Clock.systemUTC(), new OkHttpClient())) {
            assertEquals(2, pipeline.feedback().size());
        }
        String csv = Files.readString(export);
        assertTrue(csv.startsWith("name,value,timestamp,tags"));
        assertTrue(csv.contains("feedback.total_collected"));
    }

    private int execute(String... args) {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true).execute(Main.normalizeModes(args));
    }

    private Path writeConfig() throws Exception {
        Path state = tempDir.resolve("state");
        Path config = tempDir.resolve("config.yml");
        Files.writeString(config, String.join("\n",
                "storage:",
                "  stateDir: \"" + state.toString().replace("\\", "/") + "\"",
                "  corpusPath: \"" + state.resolve("incidents.json").toString().replace("\\", "/") + "\"",
                "families:",
                "  - name: default",
                "    categories: []",
                ""));
        return config;
    }
}
