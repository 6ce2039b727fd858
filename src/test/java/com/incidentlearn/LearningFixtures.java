package com.incidentlearn;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.corpus.JsonIncidentCorpus;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.FeedbackOutcome;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.feedback.FeedbackSource;

/** Seeds feedback and incidents whose outcome is fully determined by the incident text. */
public final class LearningFixtures {
    private LearningFixtures() {
    }

    public static void seedSeparable(FeedbackAggregator feedback, JsonIncidentCorpus corpus, int count, Instant start) throws IOException {
        for (int i = 0; i < count; i++) {
            boolean resolved = i % 2 == 0;
            String incidentId = "INC-" + i;
            Instant at = start.plus(Duration.ofMinutes(i));
            corpus.add(new IncidentObservation(
                    incidentId,
                    resolved ? "database" : "storage",
                    resolved ? "db" : "nas",
                    resolved ? "connection pool exhausted restart service" : "disk quota exceeded cleanup volume",
                    "high",
                    at,
                    Duration.ofMinutes(resolved ? 20 : 90)));
            feedback.record(new FeedbackRecord(
                    incidentId,
                    i % 3 == 0 ? FeedbackSource.USER : FeedbackSource.OPERATOR,
                    resolved ? "SOL-restart" : "SOL-cleanup",
                    null,
                    resolved ? FeedbackOutcome.SUCCESS : FeedbackOutcome.FAILURE,
                    resolved ? 5 : 2,
                    Duration.ofMinutes(resolved ? 20 : 90),
                    at));
        }
    }

    /** Database incidents that look like the separable successes but now fail; a model trained on the former scores zero. */
    public static void seedRegressed(FeedbackAggregator feedback, JsonIncidentCorpus corpus, int count, Instant start) throws IOException {
        for (int i = 0; i < count; i++) {
            String incidentId = "INC-R-" + i;
            Instant at = start.plus(Duration.ofMinutes(i));
            corpus.add(new IncidentObservation(
                    incidentId,
                    "database",
                    "db",
                    "connection pool exhausted restart service",
                    "high",
                    at,
                    Duration.ofMinutes(120)));
            feedback.record(new FeedbackRecord(
                    incidentId,
                    FeedbackSource.OPERATOR,
                    "SOL-restart",
                    null,
                    FeedbackOutcome.FAILURE,
                    1,
                    Duration.ofMinutes(120),
                    at));
        }
    }
}
