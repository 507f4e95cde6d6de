package com.grademax.pipeline.exception;

public class ClassificationServiceError extends PipelineException {

    public ClassificationServiceError(String message) {
        super(message);
    }

    public ClassificationServiceError(String message, Throwable cause) {
        super(message, cause);
    }
}
