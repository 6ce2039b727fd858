package com.incidentlearn.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.storage.FileLocks;
import com.incidentlearn.training.OfflineMetrics;
import com.incidentlearn.training.TrainingHyperparameters;

/**
 * Durable record of every model version and the per-family production pointer.
 *
 * <p>State is re-read from disk at the start of every operation so separate processes (a running daemon and an
 * operator CLI) observe each other's changes. Every read-modify-write holds an exclusive lock on
 * {@code <registry>.lock}, so the compare-and-swap in {@link #promote} and {@link #rollback} is atomic across
 * processes as well as threads.
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Path registryPath;
    private final Path lockPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final List<Consumer<ProductionPointer>> productionListeners = new CopyOnWriteArrayList<>();

    public ModelRegistry(Path registryPath, Clock clock) {
        this.registryPath = Objects.requireNonNull(registryPath, "registryPath");
        this.lockPath = FileLocks.lockFileFor(registryPath);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addProductionListener(Consumer<ProductionPointer> listener) {
        productionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public ModelVersion registerCandidate(
            String family,
            Long parentId,
            TimeWindow trainingWindow,
            TrainingHyperparameters hyperparameters,
            OfflineMetrics offlineMetrics,
            String artifactPath,
            String datasetPath) throws IOException {
        return FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ModelVersion version = newCandidate(state, family, parentId, trainingWindow, hyperparameters, offlineMetrics, artifactPath, datasetPath);
            save(state);
            log.info("model.registered id={} family={} parent={}", version.id(), family, parentId);
            return version;
        });
    }

    /** Records a candidate that failed before it could be evaluated, e.g. one that exceeded its training budget. */
    public ModelVersion registerRejected(
            String family,
            Long parentId,
            TimeWindow trainingWindow,
            TrainingHyperparameters hyperparameters,
            String rationale) throws IOException {
        return FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ModelVersion candidate = newCandidate(state, family, parentId, trainingWindow, hyperparameters, null, null, null);
            ModelVersion rejected = candidate.withStatus(ModelStatus.REJECTED, clock.instant(), rationale);
            state.versions.put(rejected.id(), rejected);
            save(state);
            log.info("model.rejected id={} family={} reason={}", rejected.id(), family, rationale);
            return rejected;
        });
    }

    public synchronized Optional<ModelVersion> get(long id) throws IOException {
        return Optional.ofNullable(load().versions.get(id));
    }

    public ModelVersion require(long id) throws IOException {
        return get(id).orElseThrow(() -> new IllegalArgumentException("Unknown model version " + id));
    }

    public synchronized List<ModelVersion> list() throws IOException {
        return List.copyOf(load().versions.values());
    }

    public synchronized List<ModelVersion> list(String family, ModelStatus status) throws IOException {
        return load().versions.values().stream()
                .filter(version -> family == null || family.equals(version.family()))
                .filter(version -> status == null || status == version.status())
                .toList();
    }

    /** Moves a version one step along its lifecycle. Production changes go through {@link #promote}. */
    public ModelVersion transition(long id, ModelStatus next, String reason) throws IOException {
        if (next == ModelStatus.PRODUCTION || next == ModelStatus.RETIRED) {
            throw new IllegalArgumentException("Production changes must use promote(); requested " + next + " for model " + id);
        }
        return FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ModelVersion current = requireIn(state, id);
            if (!current.status().canTransitionTo(next)) {
                throw new IllegalTransitionException(id, current.status(), next);
            }
            ModelVersion updated = current.withStatus(next, clock.instant(), reason);
            state.versions.put(id, updated);
            save(state);
            log.info("model.transition id={} from={} to={} reason={}", id, current.status(), next, reason);
            return updated;
        });
    }

    public ModelVersion reject(long id, String rationale) throws IOException {
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("rejection requires a rationale");
        }
        return transition(id, ModelStatus.REJECTED, rationale);
    }

    public ModelVersion recordExperimentAttempt(long id) throws IOException {
        return FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ModelVersion updated = requireIn(state, id).withExperimentAttempt();
            state.versions.put(id, updated);
            save(state);
            return updated;
        });
    }

    public synchronized ProductionPointer productionPointer(String family) throws IOException {
        return load().production.getOrDefault(family, ProductionPointer.empty(family));
    }

    public Optional<Long> currentProductionId(String family) throws IOException {
        return Optional.ofNullable(productionPointer(family).modelId());
    }

    public synchronized Optional<ModelVersion> currentProduction(String family) throws IOException {
        RegistryState state = load();
        ProductionPointer pointer = state.production.get(family);
        if (pointer == null || pointer.modelId() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.versions.get(pointer.modelId()));
    }

    /**
     * Swaps the production pointer from {@code expectedCurrentId} to {@code candidateId}, retiring the previous
     * production model. The candidate must be experimenting.
     *
     * @throws ConcurrencyConflictException if the pointer no longer holds {@code expectedCurrentId}
     */
    public ProductionPointer promote(String family, Long expectedCurrentId, long candidateId, String reason) throws IOException {
        ProductionPointer updated = FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ProductionPointer current = state.production.getOrDefault(family, ProductionPointer.empty(family));
            if (!Objects.equals(current.modelId(), expectedCurrentId)) {
                throw new ConcurrencyConflictException(family, expectedCurrentId, current.modelId());
            }
            ModelVersion candidate = requireIn(state, candidateId);
            if (!family.equals(candidate.family())) {
                throw new IllegalArgumentException("Model " + candidateId + " belongs to family " + candidate.family() + ", not " + family);
            }
            if (!candidate.status().canTransitionTo(ModelStatus.PRODUCTION)) {
                throw new IllegalTransitionException(candidateId, candidate.status(), ModelStatus.PRODUCTION);
            }
            if (current.modelId() != null) {
                ModelVersion previous = requireIn(state, current.modelId());
                state.versions.put(previous.id(), previous.withStatus(ModelStatus.RETIRED, clock.instant(), "Replaced by model " + candidateId));
            }
            state.versions.put(candidateId, candidate.withStatus(ModelStatus.PRODUCTION, clock.instant(), reason));
            ProductionPointer pointer = new ProductionPointer(family, candidateId, current.version() + 1, clock.instant(), reason, current.modelId());
            state.production.put(family, pointer);
            assertSingleProduction(state, family);
            save(state);
            log.info("model.promoted family={} from={} to={} pointerVersion={}", family, current.modelId(), candidateId, pointer.version());
            return pointer;
        });
        notifyListeners(updated);
        return updated;
    }

    /**
     * Restores the model that production replaced most recently. The serving model is retired and the previous one,
     * retired by the promotion being undone, serves again. A pointer can be rolled back once.
     *
     * @throws ConcurrencyConflictException if the pointer no longer holds {@code expectedCurrentId}
     * @throws IllegalStateException if there is no previous model to restore
     */
    public ProductionPointer rollback(String family, long expectedCurrentId, String reason) throws IOException {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("rollback requires a reason");
        }
        ProductionPointer updated = FileLocks.withLock(lockPath, () -> {
            RegistryState state = load();
            ProductionPointer current = state.production.getOrDefault(family, ProductionPointer.empty(family));
            if (!Objects.equals(current.modelId(), expectedCurrentId)) {
                throw new ConcurrencyConflictException(family, expectedCurrentId, current.modelId());
            }
            if (current.previousModelId() == null) {
                throw new IllegalStateException("Family " + family + " has no previous production model to roll back to");
            }
            ModelVersion serving = requireIn(state, expectedCurrentId);
            ModelVersion restored = requireIn(state, current.previousModelId());
            if (restored.status() != ModelStatus.RETIRED) {
                throw new IllegalStateException("Model " + restored.id() + " is " + restored.status() + " and cannot be restored");
            }
            state.versions.put(serving.id(), serving.withStatus(ModelStatus.RETIRED, clock.instant(), "Rolled back: " + reason));
            state.versions.put(restored.id(), restored.withStatus(ModelStatus.PRODUCTION, clock.instant(), "Restored by rollback of model " + serving.id()));
            ProductionPointer pointer = new ProductionPointer(family, restored.id(), current.version() + 1, clock.instant(), "Rollback: " + reason, null);
            state.production.put(family, pointer);
            assertSingleProduction(state, family);
            save(state);
            log.warn("model.rolled_back family={} from={} to={} pointerVersion={} reason={}", family, serving.id(), restored.id(), pointer.version(), reason);
            return pointer;
        });
        notifyListeners(updated);
        return updated;
    }

    private void notifyListeners(ProductionPointer pointer) {
        for (Consumer<ProductionPointer> listener : productionListeners) {
            listener.accept(pointer);
        }
    }

    private ModelVersion newCandidate(
            RegistryState state,
            String family,
            Long parentId,
            TimeWindow trainingWindow,
            TrainingHyperparameters hyperparameters,
            OfflineMetrics offlineMetrics,
            String artifactPath,
            String datasetPath) {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("model family is required");
        }
        long id = ++state.lastId;
        ModelVersion version = new ModelVersion(id, parentId, family, trainingWindow, hyperparameters, offlineMetrics, clock.instant(),
                ModelStatus.CANDIDATE, artifactPath, datasetPath, null, 0, List.of());
        state.versions.put(id, version);
        return version;
    }

    private ModelVersion requireIn(RegistryState state, long id) {
        ModelVersion version = state.versions.get(id);
        if (version == null) {
            throw new IllegalArgumentException("Unknown model version " + id);
        }
        return version;
    }

    private void assertSingleProduction(RegistryState state, String family) {
        long serving = state.versions.values().stream()
                .filter(version -> family.equals(version.family()) && version.status() == ModelStatus.PRODUCTION)
                .count();
        if (serving > 1) {
            throw new IllegalStateException("Family " + family + " would have " + serving + " production models");
        }
    }

    private RegistryState load() throws IOException {
        if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
            return new RegistryState();
        }
        return mapper.readValue(registryPath.toFile(), RegistryState.class);
    }

    private void save(RegistryState state) throws IOException {
        if (registryPath.getParent() != null) {
            Files.createDirectories(registryPath.getParent());
        }
        Path temp = registryPath.resolveSibling(registryPath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public static class RegistryState {
        public long lastId;
        public Map<Long, ModelVersion> versions = new TreeMap<>();
        public Map<String, ProductionPointer> production = new TreeMap<>();
    }
}
