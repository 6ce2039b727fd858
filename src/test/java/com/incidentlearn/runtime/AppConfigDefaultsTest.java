package com.incidentlearn.runtime;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.incidentlearn.experiment.ExperimentPolicy;
import com.incidentlearn.pipeline.CycleSettings;
import com.incidentlearn.pipeline.DeploymentMonitor;
import com.incidentlearn.retraining.RetrainingPolicy;
import com.incidentlearn.training.TrainingHyperparameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldExposeDocumentedDefaults() {
        AppConfig config = new AppConfig();

        assertEquals(100, config.getRetraining().getMinSamples());
        assertEquals(0.05, config.getRetraining().getStabilityThreshold(), 1e-9);
        assertEquals(4, config.getRetraining().getMaxWindowMultiplier());
        assertEquals(0.1, config.getExperiment().getDefaultTrafficSplit(), 1e-9);
        assertEquals(0.05, config.getExperiment().getSignificanceLevel(), 1e-9);
        assertEquals(168, config.getExperiment().getHorizonHours());
        assertEquals(2, config.getExperiment().getMaxAttempts());
        assertEquals(3, config.getGovernor().getMaxConsecutiveFailedCycles());
        assertTrue(config.getRollback().isEnabled());
        assertEquals(30, config.getRollback().getMinSamples());
        assertEquals(1, config.getFamilies().size());
        assertEquals("default", config.getFamilies().get(0).getName());
    }

    @Test
    void shouldLoadBundledYamlIntoPolicies() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        AppConfig config;
        try (InputStream in = AppConfigDefaultsTest.class.getResourceAsStream("/application.yml")) {
            assertNotNull(in);
            config = mapper.readValue(in, AppConfig.class);
        }

        RetrainingPolicy retraining = config.getRetraining().toPolicy();
        List<TrainingHyperparameters> candidates = config.getRetraining().hyperparameters();
        ExperimentPolicy experiment = config.getExperiment().toPolicy();
        CycleSettings cycle = LearningPipeline.cycleSettings(config);

        assertEquals(100, retraining.minSamples());
        assertEquals(5, retraining.folds());
        assertEquals(Duration.ofHours(2), retraining.timeout());
        assertEquals(2, candidates.size());
        assertEquals(20, candidates.get(1).epochs());
        assertEquals(Duration.ofDays(7), experiment.horizon());
        assertEquals(1, experiment.primaryMetrics().size());
        assertEquals(2, experiment.guardRails().size());
        assertEquals(List.of("source", "category"), config.getValidation().getProtectedGroupings());
        assertEquals(2, config.getMetrics().getAlerts().size());
        assertFalse(config.getMetrics().getWebhook().isEnabled());
        assertEquals(Duration.ofDays(30), cycle.trainingWindow());
        assertEquals(Duration.ofMinutes(30), cycle.validationTimeout());
        assertEquals(3, cycle.maxRetries());
        DeploymentMonitor.MonitorPolicy rollback = config.getRollback().toPolicy();
        assertTrue(rollback.enabled());
        assertEquals(0.10, rollback.maxAccuracyDrop(), 1e-9);
        assertEquals(0.6, rollback.minLiveAccuracy(), 1e-9);
    }
}
