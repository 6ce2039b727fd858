package com.incidentlearn.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Continuous mode: runs each family's cycle when it is due, families in parallel, until a stop condition holds.
 * A family waiting on an experiment is polled on the shorter experiment interval.
 */
public class LearningLoop {
    private static final Logger log = LoggerFactory.getLogger(LearningLoop.class);
    private static final Set<CycleOutcome> ACTIVITY = EnumSet.of(
            CycleOutcome.PROMOTED, CycleOutcome.NOT_PROMOTED, CycleOutcome.WAITING_FOR_EXPERIMENT);

    private final List<LearningCycleOrchestrator> orchestrators;
    private final LoopSettings settings;
    private final ExecutorService familyPool;
    private final Path statePath;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public LearningLoop(List<LearningCycleOrchestrator> orchestrators, LoopSettings settings, ExecutorService familyPool, Path statePath,
            Clock clock) {
        if (orchestrators.isEmpty()) {
            throw new IllegalArgumentException("at least one model family is required");
        }
        this.orchestrators = List.copyOf(orchestrators);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.familyPool = Objects.requireNonNull(familyPool, "familyPool");
        this.statePath = Objects.requireNonNull(statePath, "statePath");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public LoopState runLoop() throws IOException, InterruptedException {
        validateSettings();
        LoopState state = loadState();
        long processStart = clock.millis();
        if (state.startedAtEpochMs <= 0) {
            state.startedAtEpochMs = processStart;
        }
        state.lastActivityAtEpochMs = processStart;
        state.iterationsThisRun = 0;
        persistState(state);

        while (!stopRequested.get()) {
            long now = clock.millis();
            if (shouldStop(state, processStart, now)) {
                break;
            }

            Map<String, Future<CycleReport>> futures = new LinkedHashMap<>();
            for (LearningCycleOrchestrator orchestrator : orchestrators) {
                if (isDue(state.lastRunAtEpochMs.getOrDefault(orchestrator.family(), 0L), intervalFor(orchestrator), now)) {
                    futures.put(orchestrator.family(), familyPool.submit(orchestrator::runCycle));
                }
            }
            if (!futures.isEmpty()) {
                state.totalIterations++;
                state.iterationsThisRun++;
                state.lastStatus = "running";
                for (Map.Entry<String, Future<CycleReport>> entry : futures.entrySet()) {
                    String family = entry.getKey();
                    try {
                        CycleReport report = entry.getValue().get();
                        state.lastOutcome.put(family, String.valueOf(report.outcome()));
                        if (ACTIVITY.contains(report.outcome())) {
                            state.lastActivityAtEpochMs = clock.millis();
                        }
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause() == null ? e : e.getCause();
                        state.lastOutcome.put(family, CycleOutcome.FAILED.name());
                        state.lastError = cause.getMessage();
                        log.error("loop.family.failed family={} reason={}", family, cause.getMessage(), cause);
                    }
                    state.lastRunAtEpochMs.put(family, clock.millis());
                }
                state.lastStatus = "idle";
                state.lastUpdatedAtEpochMs = clock.millis();
                persistState(state);
            }

            long sleepMs = computeSleepMillis(state, clock.millis());
            if (sleepMs > 0 && !stopRequested.get()) {
                Thread.sleep(sleepMs);
            }
        }

        state.lastStatus = stopRequested.get() ? "stopped" : "completed";
        state.lastUpdatedAtEpochMs = clock.millis();
        persistState(state);
        return state;
    }

    private void validateSettings() {
        if (settings.cycleIntervalMs() < 0 || settings.experimentPollIntervalMs() < 0) {
            throw new IllegalArgumentException("loop intervals must be >= 0");
        }
    }

    private boolean shouldStop(LoopState state, long processStart, long now) {
        if (settings.maxCycles() > 0 && state.iterationsThisRun >= settings.maxCycles()) {
            log.info("loop.stop reason=max-cycles cycles={}", state.iterationsThisRun);
            return true;
        }
        if (settings.maxRuntimeMs() > 0 && (now - processStart) >= settings.maxRuntimeMs()) {
            log.info("loop.stop reason=max-runtime runtimeMs={}", now - processStart);
            return true;
        }
        if (settings.idleTimeoutMs() > 0 && (now - state.lastActivityAtEpochMs) >= settings.idleTimeoutMs()) {
            log.info("loop.stop reason=idle-timeout idleMs={}", now - state.lastActivityAtEpochMs);
            return true;
        }
        return false;
    }

    private long intervalFor(LearningCycleOrchestrator orchestrator) throws IOException {
        CycleState cycle = orchestrator.state();
        return cycle.inProgress() && cycle.lastOutcome == CycleOutcome.WAITING_FOR_EXPERIMENT
                ? settings.experimentPollIntervalMs()
                : settings.cycleIntervalMs();
    }

    private boolean isDue(long lastRunAtEpochMs, long intervalMs, long now) {
        if (lastRunAtEpochMs <= 0) {
            return true;
        }
        return now - lastRunAtEpochMs >= intervalMs;
    }

    private long computeSleepMillis(LoopState state, long now) throws IOException {
        long nextDue = Long.MAX_VALUE;
        for (LearningCycleOrchestrator orchestrator : orchestrators) {
            nextDue = Math.min(nextDue, remaining(state.lastRunAtEpochMs.getOrDefault(orchestrator.family(), 0L), intervalFor(orchestrator), now));
        }
        long bounded = Math.max(200L, Math.min(nextDue, 1000L));
        return nextDue == Long.MAX_VALUE ? 1000L : bounded;
    }

    private long remaining(long lastRunAtEpochMs, long intervalMs, long now) {
        if (lastRunAtEpochMs <= 0 || intervalMs == 0) {
            return 0;
        }
        long elapsed = now - lastRunAtEpochMs;
        return elapsed >= intervalMs ? 0 : intervalMs - elapsed;
    }

    private LoopState loadState() throws IOException {
        if (!Files.exists(statePath)) {
            return new LoopState();
        }
        return mapper.readValue(statePath.toFile(), LoopState.class);
    }

    private void persistState(LoopState state) throws IOException {
        Path parent = statePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(statePath.toFile(), state);
    }

    public record LoopSettings(long cycleIntervalMs, long experimentPollIntervalMs, long maxCycles, long maxRuntimeMs, long idleTimeoutMs) {
    }

    public static class LoopState {
        public long startedAtEpochMs;
        public long totalIterations;
        public long iterationsThisRun;
        public long lastActivityAtEpochMs;
        public long lastUpdatedAtEpochMs;
        public String lastStatus;
        public String lastError;
        public Map<String, Long> lastRunAtEpochMs = new TreeMap<>();
        public Map<String, String> lastOutcome = new TreeMap<>();
    }
}
