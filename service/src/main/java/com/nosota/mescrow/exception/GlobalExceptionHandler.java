package com.nosota.mescrow.exception;

import com.nosota.mescrow.dto.ErrorResponse;
import com.nosota.mescrow.error.AuthorizationException;
import com.nosota.mescrow.error.CapacityExceededException;
import com.nosota.mescrow.error.DuplicateVoteException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.EscrowStateException;
import com.nosota.mescrow.error.EscrowValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(
            AuthorizationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Unauthorized escrow operation [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
    }

    @ExceptionHandler(EscrowNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEscrowNotFound(
            EscrowNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Escrow not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.NOT_FOUND, "Escrow Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(EscrowStateException.class)
    public ResponseEntity<ErrorResponse> handleEscrowState(
            EscrowStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Escrow state conflict [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid Escrow State", ex.getMessage(), request);
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(
            CapacityExceededException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Capacity exceeded [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Capacity Exceeded", ex.getMessage(), request);
    }

    @ExceptionHandler(DuplicateVoteException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateVote(
            DuplicateVoteException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Duplicate vote [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Duplicate Vote", ex.getMessage(), request);
    }

    @ExceptionHandler(EscrowValidationException.class)
    public ResponseEntity<ErrorResponse> handleEscrowValidation(
            EscrowValidationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Escrow validation error [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed [correlationId={}]: {}", correlationId, message);

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Constraint violation [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Malformed request [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
