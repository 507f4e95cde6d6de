package com.grademax.pipeline.exception;

public class WorksheetAssemblyException extends PipelineException {

    public WorksheetAssemblyException(String message) {
        super(message);
    }

    public WorksheetAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
