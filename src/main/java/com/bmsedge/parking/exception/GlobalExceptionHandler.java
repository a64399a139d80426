package com.bmsedge.parking.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidIntervalException.class, InvalidRequestException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(ParkingEngineException ex) {
        return build(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({ShiftAlreadyActiveException.class, ShiftNotActiveException.class,
            FeeAlreadyAssessedException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(ParkingEngineException ex) {
        return build(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(DiscrepancyAcknowledgementRequiredException.class)
    public ResponseEntity<Map<String, Object>> handleUnacknowledged(DiscrepancyAcknowledgementRequiredException ex) {
        Map<String, Object> body = body(HttpStatus.CONFLICT, ex);
        body.put("discrepancy", ex.getDiscrepancy());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(AggregationInconsistencyException.class)
    public ResponseEntity<Map<String, Object>> handleInconsistency(AggregationInconsistencyException ex) {
        log.error("DATA INTEGRITY ALERT: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, ParkingEngineException ex) {
        return ResponseEntity.status(status).body(body(status, ex));
    }

    private Map<String, Object> body(HttpStatus status, ParkingEngineException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", ex.getCode());
        body.put("message", ex.getMessage());
        return body;
    }
}
