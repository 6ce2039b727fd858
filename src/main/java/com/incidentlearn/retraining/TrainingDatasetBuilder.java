package com.incidentlearn.retraining;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.incidentlearn.corpus.IncidentCorpus;
import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.feedback.FeedbackOutcome;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.training.TrainingExample;

/** Joins resolved feedback with incident context into labelled examples. */
public class TrainingDatasetBuilder {
    public static final String GROUP_SOURCE = "source";
    public static final String GROUP_CATEGORY = "category";
    public static final String GROUP_SYSTEM = "system";
    public static final String UNCATEGORIZED = "uncategorized";

    private final IncidentCorpus corpus;

    public TrainingDatasetBuilder(IncidentCorpus corpus) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
    }

    /** Feedback whose incident falls in {@code categories}; empty keeps everything. */
    public List<FeedbackRecord> inCategories(List<FeedbackRecord> feedback, Set<String> categories) {
        if (categories.isEmpty()) {
            return feedback;
        }
        Map<String, IncidentObservation> incidents = corpus.findAll(feedback.stream().map(FeedbackRecord::incidentId).distinct().toList());
        return feedback.stream()
                .filter(record -> categories.contains(categoryOf(incidents.get(record.incidentId()))))
                .toList();
    }

    public static String categoryOf(IncidentObservation incident) {
        return incident == null ? UNCATEGORIZED : incident.category();
    }

    /**
     * @param categories incident categories to keep; empty keeps everything
     */
    public List<TrainingExample> build(List<FeedbackRecord> feedback, Set<String> categories) {
        Map<String, IncidentObservation> incidents = corpus.findAll(feedback.stream().map(FeedbackRecord::incidentId).distinct().toList());
        List<TrainingExample> examples = new ArrayList<>();
        for (FeedbackRecord record : feedback) {
            if (record.outcome() == FeedbackOutcome.UNKNOWN) {
                continue;
            }
            IncidentObservation incident = incidents.get(record.incidentId());
            String category = categoryOf(incident);
            if (!categories.isEmpty() && !categories.contains(category)) {
                continue;
            }
            String system = incident == null ? "unknown" : incident.system();
            String description = incident == null ? "" : incident.description();

            Map<String, String> groups = new HashMap<>();
            groups.put(GROUP_SOURCE, record.source().wireName());
            groups.put(GROUP_CATEGORY, category);
            groups.put(GROUP_SYSTEM, system);
            String text = String.join(" ",
                    "category " + category,
                    "system " + system,
                    description,
                    "solution " + (record.suggestedSolutionId() == null ? "none" : record.suggestedSolutionId()));
            examples.add(new TrainingExample(
                    record.incidentId() + ":" + record.source().wireName(),
                    text,
                    record.suggestedSolutionId(),
                    record.outcome() == FeedbackOutcome.SUCCESS,
                    record.recordedAt(),
                    groups));
        }
        return examples;
    }
}
