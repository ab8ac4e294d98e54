package com.fintech.enrichment.controller;

import com.fintech.enrichment.exception.JobAlreadyRunningException;
import com.fintech.enrichment.exception.NoActiveJobException;
import com.fintech.enrichment.exception.PreflightException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class EnrichmentExceptionHandler {

    @ExceptionHandler(PreflightException.class)
    public ResponseEntity<Map<String, Object>> handlePreflight(PreflightException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "preflight_failed");
        body.put("message", ex.getMessage());
        body.put("problems", ex.getProblems());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyRunning(JobAlreadyRunningException ex) {
        log.warn(ex.getMessage());
        return new ResponseEntity<>(Map.of("error", "job_running", "message", ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(NoActiveJobException.class)
    public ResponseEntity<Map<String, Object>> handleNoActiveJob(NoActiveJobException ex) {
        return new ResponseEntity<>(Map.of("error", "no_job", "message", ex.getMessage()), HttpStatus.NOT_FOUND);
    }
}
