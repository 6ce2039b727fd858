package com.incidentlearn.patterns;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.feedback.TimeWindow;

/**
 * Read-only snapshot handed to every detector. {@code incidents} covers the whole analysis window;
 * {@code recentWindow} marks the trailing part compared against history.
 */
public record AnalysisInput(
        TimeWindow analysisWindow,
        TimeWindow recentWindow,
        List<FeedbackRecord> feedback,
        List<IncidentObservation> incidents,
        Map<String, Baseline> baselines,
        Instant analyzedAt) {

    public AnalysisInput {
        Objects.requireNonNull(analysisWindow, "analysisWindow");
        Objects.requireNonNull(recentWindow, "recentWindow");
        Objects.requireNonNull(analyzedAt, "analyzedAt");
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
        incidents = incidents == null ? List.of() : List.copyOf(incidents);
        baselines = baselines == null ? Map.of() : Map.copyOf(baselines);
    }

    public List<IncidentObservation> recentIncidents() {
        return incidents.stream().filter(incident -> recentWindow.contains(incident.occurredAt())).toList();
    }

    public List<IncidentObservation> historicalIncidents() {
        return incidents.stream().filter(incident -> incident.occurredAt().isBefore(recentWindow.start())).toList();
    }

    public Map<String, IncidentObservation> incidentsById() {
        Map<String, IncidentObservation> byId = new HashMap<>();
        for (IncidentObservation incident : incidents) {
            byId.put(incident.incidentId(), incident);
        }
        return byId;
    }
}
