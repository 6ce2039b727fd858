package com.incidentlearn.corpus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.incidentlearn.feedback.TimeWindow;

/** Read access to the historical incident corpus owned by the incident store. */
public interface IncidentCorpus {
    List<IncidentObservation> between(TimeWindow window);

    Optional<IncidentObservation> find(String incidentId);

    default Map<String, IncidentObservation> findAll(Collection<String> incidentIds) {
        Map<String, IncidentObservation> found = new LinkedHashMap<>();
        for (String id : incidentIds) {
            find(id).ifPresent(observation -> found.put(id, observation));
        }
        return found;
    }
}
