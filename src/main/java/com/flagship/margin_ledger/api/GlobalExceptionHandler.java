package com.flagship.margin_ledger.api;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger and margin failures to HTTP responses.
 *
 * Each {@link ErrorKind} has one status; the kind is returned as {@code code}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomainException(DomainException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("Dependency failure: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.info("Request rejected: code={}, message={}", e.getCode(), e.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .code(e.getCode())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .code(ErrorKind.VALIDATION.name())
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .code(ErrorKind.VALIDATION.name())
            .message("Malformed request")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .code("INTERNAL")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, UNBALANCED_ENTRY, INVALID_LEVERAGE -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_AVAILABLE_BALANCE, INSUFFICIENT_MARGIN, RISK_LIMIT_EXCEEDED,
                    ALREADY_EXISTS, POSITION_ALREADY_CLOSED -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RETRYABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
