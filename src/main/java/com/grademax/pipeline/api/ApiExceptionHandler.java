package com.grademax.pipeline.api;

import com.grademax.pipeline.exception.DocumentReadException;
import com.grademax.pipeline.exception.NotFoundException;
import com.grademax.pipeline.exception.PipelineException;
import com.grademax.pipeline.exception.SegmentationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({SegmentationFailure.class, DocumentReadException.class})
    public ResponseEntity<ErrorResponse> unprocessable(PipelineException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> failed(PipelineException e) {
        log.error("Request failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(int status, String message, Instant timestamp) {}
}
