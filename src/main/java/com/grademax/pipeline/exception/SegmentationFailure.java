package com.grademax.pipeline.exception;

public class SegmentationFailure extends PipelineException {

    public SegmentationFailure(String message) {
        super(message);
    }
}
