package com.grademax.pipeline.classification;

import com.grademax.pipeline.classification.ClassificationModels.ClassificationItem;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.config.SubjectProfile;

import java.util.List;

@FunctionalInterface
public interface ClassificationClient {
    List<ExternalClassification> classifyBatch(SubjectProfile subject, List<ClassificationItem> items);
}
