package com.grademax.pipeline.classification;

import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.PipelineIssue;

import java.util.List;

public class ClassificationModels {
    public record ClassificationItem(int index, String questionText, String markSchemeSnippet) {}

    public record ExternalClassification(int index, String topicCode, Difficulty difficulty, double confidence) {}

    public record KeywordMatch(String topicCode, double score, double confidence, int negativeHits) {
        public boolean hit() {
            return topicCode != null;
        }
    }

    public record ClassificationReport(int keyword, int external, int fallback, int reviewRequired,
                                       boolean cancelled, List<PipelineIssue> issues) {}
}
