package com.premiergroup.ad_delivery_engine.controller;

import com.premiergroup.ad_delivery_engine.dto.ApiError;
import com.premiergroup.ad_delivery_engine.enums.ErrorType;
import com.premiergroup.ad_delivery_engine.exception.AdEngineException;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.stream.Collectors;

@RestControllerAdvice
@RequiredArgsConstructor
@Log4j2
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(AdEngineException.class)
    public ResponseEntity<ApiError> handleEngineException(AdEngineException e) {
        if (e.getErrorType().getStatus().is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getErrorType(), e.getMessage());
        }
        return build(e.getErrorType(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return build(ErrorType.VALIDATION_ERROR, message);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));
        return build(ErrorType.VALIDATION_ERROR, message);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        return build(ErrorType.VALIDATION_ERROR, e.getMessage());
    }

    @ExceptionHandler({OptimisticLockingFailureException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<ApiError> handleLockFailure(RuntimeException e) {
        log.warn("Concurrent update rejected: {}", e.getMessage());
        return build(ErrorType.CONFLICT, "The resource was modified concurrently, retry the request");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Write rejected by a database constraint: {}", e.getMostSpecificCause().getMessage());
        return build(ErrorType.CONFLICT, "The request conflicts with stored data or exceeds a stored field limit");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unexpected error while handling request", e);
        return build(ErrorType.INTERNAL_ERROR, "Internal server error");
    }

    private ResponseEntity<ApiError> build(ErrorType type, String message) {
        return ResponseEntity.status(type.getStatus()).body(new ApiError(type, message, clock.instant()));
    }
}
