package com.grademax.pipeline.exception;

public class DocumentReadException extends PipelineException {

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
