package com.grademax.pipeline.domain;

public record PipelineIssue(String code, String message, String questionNumber, String partCode) {
    public static PipelineIssue paper(String code, String message) {
        return new PipelineIssue(code, message, null, null);
    }

    public static PipelineIssue unit(String code, String message, QuestionUnit unit) {
        return new PipelineIssue(code, message, unit.getQuestionNumber(), unit.getPartCode());
    }

    public static final class Codes {
        public static final String SEGMENTATION_FAILURE = "SEGMENTATION_FAILURE";
        public static final String SEGMENTATION_WARNING = "SEGMENTATION_WARNING";
        public static final String LINKING_UNMATCHED = "LINKING_UNMATCHED";
        public static final String CLASSIFICATION_SERVICE_ERROR = "CLASSIFICATION_SERVICE_ERROR";
        public static final String LOW_CONFIDENCE_CLASSIFICATION = "LOW_CONFIDENCE_CLASSIFICATION";
        public static final String DOCUMENT_UNREADABLE = "DOCUMENT_UNREADABLE";
        public static final String INGESTION_ERROR = "INGESTION_ERROR";

        private Codes() {
        }
    }
}
