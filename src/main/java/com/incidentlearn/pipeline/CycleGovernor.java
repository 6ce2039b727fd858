package com.incidentlearn.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Halts a family's cycles after too many consecutive failures, or while a cooldown after a safety abort is active.
 * Each halt appends an incident naming the root cause and the operator action needed.
 */
public class CycleGovernor {
    private final GovernorPolicy policy;
    private final Path stateDirectory;
    private final Path incidentLogPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public CycleGovernor(GovernorPolicy policy, Path stateDirectory, Path incidentLogPath, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.stateDirectory = Objects.requireNonNull(stateDirectory, "stateDirectory");
        this.incidentLogPath = Objects.requireNonNull(incidentLogPath, "incidentLogPath");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized GovernorDecision evaluate(String family) throws IOException {
        GovernorState state = loadState(family);
        Instant now = clock.instant();
        if (state.consecutiveFailedCycles() >= policy.maxConsecutiveFailedCycles()) {
            return halt(family, RootCauseCategory.FAILURE_STREAK_EXCEEDED,
                    "Maximum consecutive failed cycles reached (" + state.consecutiveFailedCycles() + ")",
                    "Investigate the failed cycles, then resume the family to clear the streak");
        }
        if (state.lastSafetyAbortAtEpochMs() > 0) {
            Instant resumeAt = Instant.ofEpochMilli(state.lastSafetyAbortAtEpochMs()).plus(policy.safetyCooldown());
            if (resumeAt.isAfter(now)) {
                return halt(family, RootCauseCategory.SAFETY_COOLDOWN_ACTIVE,
                        "Safety abort cooldown is active until " + resumeAt,
                        "Wait for cooldown expiry or review the aborted experiment");
            }
        }
        return GovernorDecision.pass("All governor checks passed");
    }

    public synchronized void recordOutcome(String family, boolean success, boolean safetyAbort) throws IOException {
        GovernorState state = loadState(family);
        int failures = success ? 0 : state.consecutiveFailedCycles() + 1;
        long abortAt = safetyAbort ? clock.millis() : state.lastSafetyAbortAtEpochMs();
        saveState(family, new GovernorState(failures, abortAt));
    }

    /** Clears the failure streak; an active safety cooldown still applies. */
    public synchronized void reset(String family) throws IOException {
        GovernorState state = loadState(family);
        saveState(family, new GovernorState(0, state.lastSafetyAbortAtEpochMs()));
    }

    public synchronized GovernorState state(String family) throws IOException {
        return loadState(family);
    }

    public List<IncidentRecord> incidents() throws IOException {
        List<IncidentRecord> incidents = new ArrayList<>();
        if (!Files.exists(incidentLogPath)) {
            return incidents;
        }
        for (String line : Files.readAllLines(incidentLogPath)) {
            if (!line.isBlank()) {
                incidents.add(mapper.readValue(line, IncidentRecord.class));
            }
        }
        return incidents;
    }

    private GovernorDecision halt(String family, RootCauseCategory category, String summary, String requiredAction) throws IOException {
        String incidentId = "incident-" + family + "-" + clock.millis();
        IncidentRecord record = new IncidentRecord(incidentId, clock.instant(), family, category, summary, requiredAction, true);
        appendIncident(record);
        return GovernorDecision.halt(summary, incidentId);
    }

    private GovernorState loadState(String family) throws IOException {
        Path path = statePath(family);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new GovernorState(0, -1);
        }
        return mapper.readValue(path.toFile(), GovernorState.class);
    }

    private void saveState(String family, GovernorState state) throws IOException {
        Files.createDirectories(stateDirectory);
        mapper.writerWithDefaultPrettyPrinter().writeValue(statePath(family).toFile(), state);
    }

    private void appendIncident(IncidentRecord record) throws IOException {
        if (incidentLogPath.getParent() != null) {
            Files.createDirectories(incidentLogPath.getParent());
        }
        String json = mapper.writeValueAsString(record) + System.lineSeparator();
        Files.writeString(incidentLogPath, json, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private Path statePath(String family) {
        return stateDirectory.resolve("governor-state-" + family + ".json");
    }

    public record GovernorPolicy(int maxConsecutiveFailedCycles, Duration safetyCooldown) {
        public static GovernorPolicy defaults() {
            return new GovernorPolicy(3, Duration.ofMinutes(60));
        }
    }

    public record GovernorDecision(boolean continueRunning, boolean halted, String reason, String incidentId) {
        public static GovernorDecision pass(String reason) {
            return new GovernorDecision(true, false, reason, "");
        }

        public static GovernorDecision halt(String reason, String incidentId) {
            return new GovernorDecision(false, true, reason, incidentId);
        }
    }

    public record GovernorState(int consecutiveFailedCycles, long lastSafetyAbortAtEpochMs) {
    }

    public record IncidentRecord(
            String incidentId,
            Instant occurredAt,
            String family,
            RootCauseCategory rootCauseCategory,
            String summary,
            String requiredOperatorAction,
            boolean halted) {
    }

    public enum RootCauseCategory {
        FAILURE_STREAK_EXCEEDED,
        SAFETY_COOLDOWN_ACTIVE
    }
}
