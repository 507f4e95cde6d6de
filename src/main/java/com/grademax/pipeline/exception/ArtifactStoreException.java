package com.grademax.pipeline.exception;

public class ArtifactStoreException extends PipelineException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
