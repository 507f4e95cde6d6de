package com.grademax.pipeline.exception;

public class NotFoundException extends PipelineException {

    public NotFoundException(String message) {
        super(message);
    }
}
