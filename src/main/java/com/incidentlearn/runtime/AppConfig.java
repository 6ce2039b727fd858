package com.incidentlearn.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.incidentlearn.experiment.ExperimentPolicy;
import com.incidentlearn.experiment.GuardRailMetric;
import com.incidentlearn.experiment.MetricKind;
import com.incidentlearn.experiment.PrimaryMetric;
import com.incidentlearn.metrics.AggregateFunction;
import com.incidentlearn.metrics.AlertComparator;
import com.incidentlearn.metrics.AlertRule;
import com.incidentlearn.metrics.AlertSeverity;
import com.incidentlearn.pipeline.DeploymentMonitor;
import com.incidentlearn.retraining.RetrainingPolicy;
import com.incidentlearn.training.TrainingHyperparameters;
import com.incidentlearn.validation.ValidationPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private FeedbackConfig feedback = new FeedbackConfig();
    private PatternsConfig patterns = new PatternsConfig();
    private RetrainingConfig retraining = new RetrainingConfig();
    private ValidationConfig validation = new ValidationConfig();
    private ExperimentConfig experiment = new ExperimentConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ContinuousModeConfig continuous = new ContinuousModeConfig();
    private GovernorConfig governor = new GovernorConfig();
    private RollbackConfig rollback = new RollbackConfig();
    private List<FamilyConfig> families = new ArrayList<>(List.of(new FamilyConfig()));

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public FeedbackConfig getFeedback() {
        return feedback;
    }

    public void setFeedback(FeedbackConfig feedback) {
        this.feedback = feedback == null ? new FeedbackConfig() : feedback;
    }

    public PatternsConfig getPatterns() {
        return patterns;
    }

    public void setPatterns(PatternsConfig patterns) {
        this.patterns = patterns == null ? new PatternsConfig() : patterns;
    }

    public RetrainingConfig getRetraining() {
        return retraining;
    }

    public void setRetraining(RetrainingConfig retraining) {
        this.retraining = retraining == null ? new RetrainingConfig() : retraining;
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    public void setValidation(ValidationConfig validation) {
        this.validation = validation == null ? new ValidationConfig() : validation;
    }

    public ExperimentConfig getExperiment() {
        return experiment;
    }

    public void setExperiment(ExperimentConfig experiment) {
        this.experiment = experiment == null ? new ExperimentConfig() : experiment;
    }

    public MetricsConfig getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsConfig metrics) {
        this.metrics = metrics == null ? new MetricsConfig() : metrics;
    }

    public ContinuousModeConfig getContinuous() {
        return continuous;
    }

    public void setContinuous(ContinuousModeConfig continuous) {
        this.continuous = continuous == null ? new ContinuousModeConfig() : continuous;
    }

    public GovernorConfig getGovernor() {
        return governor;
    }

    public void setGovernor(GovernorConfig governor) {
        this.governor = governor == null ? new GovernorConfig() : governor;
    }

    public RollbackConfig getRollback() {
        return rollback;
    }

    public void setRollback(RollbackConfig rollback) {
        this.rollback = rollback == null ? new RollbackConfig() : rollback;
    }

    public List<FamilyConfig> getFamilies() {
        return families;
    }

    public void setFamilies(List<FamilyConfig> families) {
        this.families = families == null ? new ArrayList<>() : families;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String stateDir = ".incidentlearn";
        private String corpusPath = ".incidentlearn/incidents.json";

        public String getStateDir() {
            return stateDir;
        }

        public void setStateDir(String stateDir) {
            this.stateDir = stateDir;
        }

        public String getCorpusPath() {
            return corpusPath;
        }

        public void setCorpusPath(String corpusPath) {
            this.corpusPath = corpusPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeedbackConfig {
        private int retentionDays = 90;
        private int retrainThreshold = 50;

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public int getRetrainThreshold() {
            return retrainThreshold;
        }

        public void setRetrainThreshold(int retrainThreshold) {
            this.retrainThreshold = retrainThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PatternsConfig {
        private int analysisWindowDays = 30;
        private int recentWindowHours = 24;
        private int embeddingDimension = 256;
        private double noveltyDistance = 0.6;
        private int minClusterNeighbors = 3;
        private int clusterTimeSpanHours = 24;
        private double clusterRadius = 0.5;
        private double shiftThreshold = 0.30;
        private int shiftMinSamples = 10;
        private double trendSignificance = 0.05;
        private double trendMinRelativeSlope = 0.05;
        private int trendMinPoints = 5;
        private int trendBucketHours = 24;
        private int trendProjectionBuckets = 7;
        private double correlationThreshold = 0.7;
        private int correlationMinSupport = 5;
        private int correlationBucketHours = 1;
        private double anomalyZThreshold = 2.5;
        private int anomalyBucketMinutes = 60;
        private int anomalyMinBuckets = 24;
        private long detectorTimeoutMs = 60000;
        private double baselineSmoothing = 0.2;
        private double minPatternConfidence = 0.5;
        private int detectorThreads = 4;

        public int getAnalysisWindowDays() {
            return analysisWindowDays;
        }

        public void setAnalysisWindowDays(int analysisWindowDays) {
            this.analysisWindowDays = analysisWindowDays;
        }

        public int getRecentWindowHours() {
            return recentWindowHours;
        }

        public void setRecentWindowHours(int recentWindowHours) {
            this.recentWindowHours = recentWindowHours;
        }

        public int getEmbeddingDimension() {
            return embeddingDimension;
        }

        public void setEmbeddingDimension(int embeddingDimension) {
            this.embeddingDimension = embeddingDimension;
        }

        public double getNoveltyDistance() {
            return noveltyDistance;
        }

        public void setNoveltyDistance(double noveltyDistance) {
            this.noveltyDistance = noveltyDistance;
        }

        public int getMinClusterNeighbors() {
            return minClusterNeighbors;
        }

        public void setMinClusterNeighbors(int minClusterNeighbors) {
            this.minClusterNeighbors = minClusterNeighbors;
        }

        public int getClusterTimeSpanHours() {
            return clusterTimeSpanHours;
        }

        public void setClusterTimeSpanHours(int clusterTimeSpanHours) {
            this.clusterTimeSpanHours = clusterTimeSpanHours;
        }

        public double getClusterRadius() {
            return clusterRadius;
        }

        public void setClusterRadius(double clusterRadius) {
            this.clusterRadius = clusterRadius;
        }

        public double getShiftThreshold() {
            return shiftThreshold;
        }

        public void setShiftThreshold(double shiftThreshold) {
            this.shiftThreshold = shiftThreshold;
        }

        public int getShiftMinSamples() {
            return shiftMinSamples;
        }

        public void setShiftMinSamples(int shiftMinSamples) {
            this.shiftMinSamples = shiftMinSamples;
        }

        public double getTrendSignificance() {
            return trendSignificance;
        }

        public void setTrendSignificance(double trendSignificance) {
            this.trendSignificance = trendSignificance;
        }

        public double getTrendMinRelativeSlope() {
            return trendMinRelativeSlope;
        }

        public void setTrendMinRelativeSlope(double trendMinRelativeSlope) {
            this.trendMinRelativeSlope = trendMinRelativeSlope;
        }

        public int getTrendMinPoints() {
            return trendMinPoints;
        }

        public void setTrendMinPoints(int trendMinPoints) {
            this.trendMinPoints = trendMinPoints;
        }

        public int getTrendBucketHours() {
            return trendBucketHours;
        }

        public void setTrendBucketHours(int trendBucketHours) {
            this.trendBucketHours = trendBucketHours;
        }

        public int getTrendProjectionBuckets() {
            return trendProjectionBuckets;
        }

        public void setTrendProjectionBuckets(int trendProjectionBuckets) {
            this.trendProjectionBuckets = trendProjectionBuckets;
        }

        public double getCorrelationThreshold() {
            return correlationThreshold;
        }

        public void setCorrelationThreshold(double correlationThreshold) {
            this.correlationThreshold = correlationThreshold;
        }

        public int getCorrelationMinSupport() {
            return correlationMinSupport;
        }

        public void setCorrelationMinSupport(int correlationMinSupport) {
            this.correlationMinSupport = correlationMinSupport;
        }

        public int getCorrelationBucketHours() {
            return correlationBucketHours;
        }

        public void setCorrelationBucketHours(int correlationBucketHours) {
            this.correlationBucketHours = correlationBucketHours;
        }

        public double getAnomalyZThreshold() {
            return anomalyZThreshold;
        }

        public void setAnomalyZThreshold(double anomalyZThreshold) {
            this.anomalyZThreshold = anomalyZThreshold;
        }

        public int getAnomalyBucketMinutes() {
            return anomalyBucketMinutes;
        }

        public void setAnomalyBucketMinutes(int anomalyBucketMinutes) {
            this.anomalyBucketMinutes = anomalyBucketMinutes;
        }

        public int getAnomalyMinBuckets() {
            return anomalyMinBuckets;
        }

        public void setAnomalyMinBuckets(int anomalyMinBuckets) {
            this.anomalyMinBuckets = anomalyMinBuckets;
        }

        public long getDetectorTimeoutMs() {
            return detectorTimeoutMs;
        }

        public void setDetectorTimeoutMs(long detectorTimeoutMs) {
            this.detectorTimeoutMs = detectorTimeoutMs;
        }

        public double getBaselineSmoothing() {
            return baselineSmoothing;
        }

        public void setBaselineSmoothing(double baselineSmoothing) {
            this.baselineSmoothing = baselineSmoothing;
        }

        public double getMinPatternConfidence() {
            return minPatternConfidence;
        }

        public void setMinPatternConfidence(double minPatternConfidence) {
            this.minPatternConfidence = minPatternConfidence;
        }

        public int getDetectorThreads() {
            return detectorThreads;
        }

        public void setDetectorThreads(int detectorThreads) {
            this.detectorThreads = detectorThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrainingConfig {
        private int trainingWindowDays = 30;
        private int maxWindowMultiplier = 4;
        private int minSamples = 100;
        private double trainFraction = 0.8;
        private int folds = 5;
        private double futureFraction = 0.1;
        private double stabilityThreshold = 0.05;
        private String primaryMetric = "accuracy";
        private long timeoutMs = 7_200_000L;
        private int workerThreads = 2;
        private int featureDimension = 512;
        private List<CandidateConfig> candidates = new ArrayList<>(List.of(new CandidateConfig()));

        public int getTrainingWindowDays() {
            return trainingWindowDays;
        }

        public void setTrainingWindowDays(int trainingWindowDays) {
            this.trainingWindowDays = trainingWindowDays;
        }

        public int getMaxWindowMultiplier() {
            return maxWindowMultiplier;
        }

        public void setMaxWindowMultiplier(int maxWindowMultiplier) {
            this.maxWindowMultiplier = maxWindowMultiplier;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getTrainFraction() {
            return trainFraction;
        }

        public void setTrainFraction(double trainFraction) {
            this.trainFraction = trainFraction;
        }

        public int getFolds() {
            return folds;
        }

        public void setFolds(int folds) {
            this.folds = folds;
        }

        public double getFutureFraction() {
            return futureFraction;
        }

        public void setFutureFraction(double futureFraction) {
            this.futureFraction = futureFraction;
        }

        public double getStabilityThreshold() {
            return stabilityThreshold;
        }

        public void setStabilityThreshold(double stabilityThreshold) {
            this.stabilityThreshold = stabilityThreshold;
        }

        public String getPrimaryMetric() {
            return primaryMetric;
        }

        public void setPrimaryMetric(String primaryMetric) {
            this.primaryMetric = primaryMetric;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getFeatureDimension() {
            return featureDimension;
        }

        public void setFeatureDimension(int featureDimension) {
            this.featureDimension = featureDimension;
        }

        public List<CandidateConfig> getCandidates() {
            return candidates;
        }

        public void setCandidates(List<CandidateConfig> candidates) {
            this.candidates = candidates == null ? new ArrayList<>() : candidates;
        }

        public RetrainingPolicy toPolicy() {
            return new RetrainingPolicy(minSamples, trainFraction, folds, futureFraction, stabilityThreshold, primaryMetric, Duration.ofMillis(timeoutMs));
        }

        public List<TrainingHyperparameters> hyperparameters() {
            return candidates.stream().map(CandidateConfig::toHyperparameters).toList();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CandidateConfig {
        private int epochs = 10;
        private double learningRate = 0.1;
        private int batchSize = 32;
        private double l2 = 0.0001;
        private long seed = 42L;

        public int getEpochs() {
            return epochs;
        }

        public void setEpochs(int epochs) {
            this.epochs = epochs;
        }

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public double getL2() {
            return l2;
        }

        public void setL2(double l2) {
            this.l2 = l2;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public TrainingHyperparameters toHyperparameters() {
            return new TrainingHyperparameters(epochs, learningRate, batchSize, l2, seed);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationConfig {
        private double minAccuracy = 0.80;
        private double minPrecision = 0.75;
        private double maxCrossFoldStddev = 0.05;
        private int bootstrapSamples = 200;
        private double maxBootstrapDeviation = 0.05;
        private double fairnessTolerance = 0.10;
        private List<String> protectedGroupings = new ArrayList<>(List.of("source", "category"));
        private int minGroupSize = 5;
        private double noiseLevel = 0.1;
        private int perturbationsPerExample = 3;
        private double minConsistency = 0.90;
        private double maxDriftDegradation = 0.10;
        private long seed = 42L;
        private long timeoutMs = 1_800_000L;
        private int workerThreads = 2;

        public double getMinAccuracy() {
            return minAccuracy;
        }

        public void setMinAccuracy(double minAccuracy) {
            this.minAccuracy = minAccuracy;
        }

        public double getMinPrecision() {
            return minPrecision;
        }

        public void setMinPrecision(double minPrecision) {
            this.minPrecision = minPrecision;
        }

        public double getMaxCrossFoldStddev() {
            return maxCrossFoldStddev;
        }

        public void setMaxCrossFoldStddev(double maxCrossFoldStddev) {
            this.maxCrossFoldStddev = maxCrossFoldStddev;
        }

        public int getBootstrapSamples() {
            return bootstrapSamples;
        }

        public void setBootstrapSamples(int bootstrapSamples) {
            this.bootstrapSamples = bootstrapSamples;
        }

        public double getMaxBootstrapDeviation() {
            return maxBootstrapDeviation;
        }

        public void setMaxBootstrapDeviation(double maxBootstrapDeviation) {
            this.maxBootstrapDeviation = maxBootstrapDeviation;
        }

        public double getFairnessTolerance() {
            return fairnessTolerance;
        }

        public void setFairnessTolerance(double fairnessTolerance) {
            this.fairnessTolerance = fairnessTolerance;
        }

        public List<String> getProtectedGroupings() {
            return protectedGroupings;
        }

        public void setProtectedGroupings(List<String> protectedGroupings) {
            this.protectedGroupings = protectedGroupings == null ? new ArrayList<>() : protectedGroupings;
        }

        public int getMinGroupSize() {
            return minGroupSize;
        }

        public void setMinGroupSize(int minGroupSize) {
            this.minGroupSize = minGroupSize;
        }

        public double getNoiseLevel() {
            return noiseLevel;
        }

        public void setNoiseLevel(double noiseLevel) {
            this.noiseLevel = noiseLevel;
        }

        public int getPerturbationsPerExample() {
            return perturbationsPerExample;
        }

        public void setPerturbationsPerExample(int perturbationsPerExample) {
            this.perturbationsPerExample = perturbationsPerExample;
        }

        public double getMinConsistency() {
            return minConsistency;
        }

        public void setMinConsistency(double minConsistency) {
            this.minConsistency = minConsistency;
        }

        public double getMaxDriftDegradation() {
            return maxDriftDegradation;
        }

        public void setMaxDriftDegradation(double maxDriftDegradation) {
            this.maxDriftDegradation = maxDriftDegradation;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public ValidationPolicy toPolicy(String primaryMetric) {
            return new ValidationPolicy(minAccuracy, minPrecision, primaryMetric, maxCrossFoldStddev, bootstrapSamples, maxBootstrapDeviation,
                    fairnessTolerance, protectedGroupings, minGroupSize, noiseLevel, perturbationsPerExample, minConsistency, maxDriftDegradation, seed);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExperimentConfig {
        private double defaultTrafficSplit = 0.1;
        private double maxTrafficSplit = 0.5;
        private double significanceLevel = 0.05;
        private long horizonHours = 168;
        private long minSamplesPerVariant = 100;
        private int maxConcurrentTests = 5;
        private double power = 0.8;
        private double minDetectableEffect = 0.05;
        private double maxNegativeImpact = -0.10;
        private double retryHorizonMultiplier = 2.0;
        private int maxAttempts = 2;
        private long evaluationIntervalMs = 60_000L;
        private List<MetricConfig> primaryMetrics = new ArrayList<>(List.of(MetricConfig.of(ExperimentPolicy.RESOLUTION_SUCCESS, MetricKind.RATE, 0.02, true)));
        private List<MetricConfig> guardRails = new ArrayList<>(List.of(
                MetricConfig.of(ExperimentPolicy.RESOLUTION_MINUTES, MetricKind.CONTINUOUS, 0.0, false),
                MetricConfig.of(ExperimentPolicy.ESCALATION, MetricKind.RATE, 0.0, false)));

        public double getDefaultTrafficSplit() {
            return defaultTrafficSplit;
        }

        public void setDefaultTrafficSplit(double defaultTrafficSplit) {
            this.defaultTrafficSplit = defaultTrafficSplit;
        }

        public double getMaxTrafficSplit() {
            return maxTrafficSplit;
        }

        public void setMaxTrafficSplit(double maxTrafficSplit) {
            this.maxTrafficSplit = maxTrafficSplit;
        }

        public double getSignificanceLevel() {
            return significanceLevel;
        }

        public void setSignificanceLevel(double significanceLevel) {
            this.significanceLevel = significanceLevel;
        }

        public long getHorizonHours() {
            return horizonHours;
        }

        public void setHorizonHours(long horizonHours) {
            this.horizonHours = horizonHours;
        }

        public long getMinSamplesPerVariant() {
            return minSamplesPerVariant;
        }

        public void setMinSamplesPerVariant(long minSamplesPerVariant) {
            this.minSamplesPerVariant = minSamplesPerVariant;
        }

        public int getMaxConcurrentTests() {
            return maxConcurrentTests;
        }

        public void setMaxConcurrentTests(int maxConcurrentTests) {
            this.maxConcurrentTests = maxConcurrentTests;
        }

        public double getPower() {
            return power;
        }

        public void setPower(double power) {
            this.power = power;
        }

        public double getMinDetectableEffect() {
            return minDetectableEffect;
        }

        public void setMinDetectableEffect(double minDetectableEffect) {
            this.minDetectableEffect = minDetectableEffect;
        }

        public double getMaxNegativeImpact() {
            return maxNegativeImpact;
        }

        public void setMaxNegativeImpact(double maxNegativeImpact) {
            this.maxNegativeImpact = maxNegativeImpact;
        }

        public double getRetryHorizonMultiplier() {
            return retryHorizonMultiplier;
        }

        public void setRetryHorizonMultiplier(double retryHorizonMultiplier) {
            this.retryHorizonMultiplier = retryHorizonMultiplier;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getEvaluationIntervalMs() {
            return evaluationIntervalMs;
        }

        public void setEvaluationIntervalMs(long evaluationIntervalMs) {
            this.evaluationIntervalMs = evaluationIntervalMs;
        }

        public List<MetricConfig> getPrimaryMetrics() {
            return primaryMetrics;
        }

        public void setPrimaryMetrics(List<MetricConfig> primaryMetrics) {
            this.primaryMetrics = primaryMetrics == null ? new ArrayList<>() : primaryMetrics;
        }

        public List<MetricConfig> getGuardRails() {
            return guardRails;
        }

        public void setGuardRails(List<MetricConfig> guardRails) {
            this.guardRails = guardRails == null ? new ArrayList<>() : guardRails;
        }

        public ExperimentPolicy toPolicy() {
            return new ExperimentPolicy(defaultTrafficSplit, maxTrafficSplit, significanceLevel, Duration.ofHours(horizonHours), minSamplesPerVariant,
                    maxConcurrentTests, power, minDetectableEffect, maxNegativeImpact, retryHorizonMultiplier,
                    primaryMetrics.stream().map(MetricConfig::toPrimaryMetric).toList(),
                    guardRails.stream().map(MetricConfig::toGuardRail).toList());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricConfig {
        private String name;
        private MetricKind kind = MetricKind.RATE;
        private double minRelativeImprovement = 0.0;
        private boolean higherIsBetter = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public MetricKind getKind() {
            return kind;
        }

        public void setKind(MetricKind kind) {
            this.kind = kind;
        }

        public double getMinRelativeImprovement() {
            return minRelativeImprovement;
        }

        public void setMinRelativeImprovement(double minRelativeImprovement) {
            this.minRelativeImprovement = minRelativeImprovement;
        }

        public boolean isHigherIsBetter() {
            return higherIsBetter;
        }

        public void setHigherIsBetter(boolean higherIsBetter) {
            this.higherIsBetter = higherIsBetter;
        }

        static MetricConfig of(String name, MetricKind kind, double minRelativeImprovement, boolean higherIsBetter) {
            MetricConfig config = new MetricConfig();
            config.setName(name);
            config.setKind(kind);
            config.setMinRelativeImprovement(minRelativeImprovement);
            config.setHigherIsBetter(higherIsBetter);
            return config;
        }

        public PrimaryMetric toPrimaryMetric() {
            return new PrimaryMetric(name, kind, minRelativeImprovement, higherIsBetter);
        }

        public GuardRailMetric toGuardRail() {
            return new GuardRailMetric(name, kind, higherIsBetter);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricsConfig {
        private long alertEvaluationIntervalMs = 60_000L;
        private List<AlertRuleConfig> alerts = new ArrayList<>();
        private WebhookConfig webhook = new WebhookConfig();

        public long getAlertEvaluationIntervalMs() {
            return alertEvaluationIntervalMs;
        }

        public void setAlertEvaluationIntervalMs(long alertEvaluationIntervalMs) {
            this.alertEvaluationIntervalMs = alertEvaluationIntervalMs;
        }

        public List<AlertRuleConfig> getAlerts() {
            return alerts;
        }

        public void setAlerts(List<AlertRuleConfig> alerts) {
            this.alerts = alerts == null ? new ArrayList<>() : alerts;
        }

        public WebhookConfig getWebhook() {
            return webhook;
        }

        public void setWebhook(WebhookConfig webhook) {
            this.webhook = webhook == null ? new WebhookConfig() : webhook;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlertRuleConfig {
        private String name;
        private String metric;
        private Map<String, String> tags = new HashMap<>();
        private AlertComparator comparator = AlertComparator.GREATER_THAN;
        private double threshold = 0.0;
        private AlertSeverity severity = AlertSeverity.MEDIUM;
        private long cooldownMinutes = 5;
        private long windowMinutes = 5;
        private AggregateFunction aggregation = AggregateFunction.AVG;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public Map<String, String> getTags() {
            return tags;
        }

        public void setTags(Map<String, String> tags) {
            this.tags = tags == null ? new HashMap<>() : tags;
        }

        public AlertComparator getComparator() {
            return comparator;
        }

        public void setComparator(AlertComparator comparator) {
            this.comparator = comparator;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public AlertSeverity getSeverity() {
            return severity;
        }

        public void setSeverity(AlertSeverity severity) {
            this.severity = severity;
        }

        public long getCooldownMinutes() {
            return cooldownMinutes;
        }

        public void setCooldownMinutes(long cooldownMinutes) {
            this.cooldownMinutes = cooldownMinutes;
        }

        public long getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(long windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public AggregateFunction getAggregation() {
            return aggregation;
        }

        public void setAggregation(AggregateFunction aggregation) {
            this.aggregation = aggregation;
        }

        public AlertRule toRule() {
            return new AlertRule(name, metric, tags, comparator, threshold, severity, Duration.ofMinutes(cooldownMinutes),
                    Duration.ofMinutes(windowMinutes), aggregation);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebhookConfig {
        private boolean enabled = false;
        private String url;
        private String bearerTokenEnv = "INCIDENT_LEARN_WEBHOOK_TOKEN";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getBearerTokenEnv() {
            return bearerTokenEnv;
        }

        public void setBearerTokenEnv(String bearerTokenEnv) {
            this.bearerTokenEnv = bearerTokenEnv;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContinuousModeConfig {
        private long cycleIntervalMs = 3_600_000L;
        private long experimentPollIntervalMs = 300_000L;
        private int maxRetries = 3;
        private long retryBackoffMs = 5000;
        private long maxCycles = 0;
        private long maxRuntimeMs = 0;
        private long idleTimeoutMs = 0;

        public long getCycleIntervalMs() {
            return cycleIntervalMs;
        }

        public void setCycleIntervalMs(long cycleIntervalMs) {
            this.cycleIntervalMs = cycleIntervalMs;
        }

        public long getExperimentPollIntervalMs() {
            return experimentPollIntervalMs;
        }

        public void setExperimentPollIntervalMs(long experimentPollIntervalMs) {
            this.experimentPollIntervalMs = experimentPollIntervalMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(long maxCycles) {
            this.maxCycles = maxCycles;
        }

        public long getMaxRuntimeMs() {
            return maxRuntimeMs;
        }

        public void setMaxRuntimeMs(long maxRuntimeMs) {
            this.maxRuntimeMs = maxRuntimeMs;
        }

        public long getIdleTimeoutMs() {
            return idleTimeoutMs;
        }

        public void setIdleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GovernorConfig {
        private int maxConsecutiveFailedCycles = 3;
        private long safetyCooldownMinutes = 60;

        public int getMaxConsecutiveFailedCycles() {
            return maxConsecutiveFailedCycles;
        }

        public void setMaxConsecutiveFailedCycles(int maxConsecutiveFailedCycles) {
            this.maxConsecutiveFailedCycles = maxConsecutiveFailedCycles;
        }

        public long getSafetyCooldownMinutes() {
            return safetyCooldownMinutes;
        }

        public void setSafetyCooldownMinutes(long safetyCooldownMinutes) {
            this.safetyCooldownMinutes = safetyCooldownMinutes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RollbackConfig {
        private boolean enabled = true;
        private int minSamples = 30;
        private double maxAccuracyDrop = 0.10;
        private double minLiveAccuracy = 0.6;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getMaxAccuracyDrop() {
            return maxAccuracyDrop;
        }

        public void setMaxAccuracyDrop(double maxAccuracyDrop) {
            this.maxAccuracyDrop = maxAccuracyDrop;
        }

        public double getMinLiveAccuracy() {
            return minLiveAccuracy;
        }

        public void setMinLiveAccuracy(double minLiveAccuracy) {
            this.minLiveAccuracy = minLiveAccuracy;
        }

        public DeploymentMonitor.MonitorPolicy toPolicy() {
            return new DeploymentMonitor.MonitorPolicy(enabled, minSamples, maxAccuracyDrop, minLiveAccuracy);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FamilyConfig {
        private String name = "default";
        private List<String> categories = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories == null ? new ArrayList<>() : categories;
        }
    }
}
