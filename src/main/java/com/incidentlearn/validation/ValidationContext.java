package com.incidentlearn.validation;

import java.util.ArrayList;
import java.util.List;

import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.retraining.DatasetSnapshot;
import com.incidentlearn.training.TrainedModel;
import com.incidentlearn.training.TrainingExample;

public record ValidationContext(ModelVersion version, TrainedModel model, DatasetSnapshot datasets, ValidationPolicy policy) {
    /** Held-out and future examples, none of which the model was trained on. */
    public List<TrainingExample> unseenExamples() {
        List<TrainingExample> unseen = new ArrayList<>(datasets.holdout());
        unseen.addAll(datasets.future());
        return unseen;
    }
}
