package com.statgrid.controller.admin;

import com.statgrid.service.core.statistic.MissingPartitionException;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Maps admin endpoint failures to {@link ErrorPayload} responses. */
@ControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class AdminErrorHandler {

    private final Clock clock;

    @ExceptionHandler(MissingPartitionException.class)
    public ResponseEntity<ErrorPayload> handleMissingPartition(MissingPartitionException ex, WebRequest request) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), request, ex.getMatrixId());
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorPayload> handleDataAccess(DataAccessException ex, WebRequest request) {
        log.error("Database error while serving admin request", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Database unavailable", request, null);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, WebRequest request, Long matrixId) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(
                Instant.now(clock), status.value(), status.getReasonPhrase(), message, path, matrixId);
        return ResponseEntity.status(status).body(body);
    }
}
