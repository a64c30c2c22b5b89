package com.logimatrix.tracking.exception;

import com.logimatrix.tracking.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain and validation failures to the uniform JSON error body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(NoLocationException.class)
    public ResponseEntity<ErrorResponse> handleNoLocation(NoLocationException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({ZoneNotFoundException.class, AlertNotFoundException.class, UnknownEntityException.class,
        NoTelemetryException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(TrackingException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({FixValidationException.class, InvalidTopicException.class})
    public ResponseEntity<ErrorResponse> handleValidation(TrackingException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ZoneRegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistry(ZoneRegistryException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ErrorResponse> handleDeadline(DeadlineExceededException e) {
        log.warn("Request hit an I/O deadline: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        Map<String, String> details = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ErrorResponse body = new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "validation_failed",
            "Request validation failed", Instant.now(), details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "bad_request", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled API error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR.value(), "internal_error", "Unexpected error"));
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, TrackingException e) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), e.getErrorCode(), e.getMessage()));
    }
}
