package com.credvault.api.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the credvault API.
 * Every error body has a single {@code detail} key.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> handleStoreException(
        StoreException ex
    ) {
        log.error(
            "Store exception on collection '{}' ({}): {}",
            ex.getCollection(),
            ex.getErrorType(),
            ex.getMessage(),
            ex
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            Map.of("detail", ex.getMessage())
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
        MethodArgumentNotValidException ex
    ) {
        log.warn("Validation error occurred: {}", ex.getMessage());

        List<Map<String, String>> fieldErrors = ex
            .getBindingResult()
            .getFieldErrors()
            .stream()
            .map(GlobalExceptionHandler::toDetail)
            .collect(Collectors.toList());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
            Map.of("detail", fieldErrors)
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(
        HttpMessageNotReadableException ex
    ) {
        log.warn("Unreadable request body: {}", ex.getMessage());

        // Jackson's own message ends with parser source details, keep only the problem
        Throwable cause = ex.getMostSpecificCause();
        String message = cause instanceof JsonProcessingException jsonError
            ? jsonError.getOriginalMessage()
            : cause.getMessage();
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
            Map.of(
                "detail",
                List.of(Map.of("field", "body", "message", message != null ? message : "Malformed JSON request"))
            )
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
        Exception ex
    ) {
        // Framework errors (unknown route, wrong method, media type) keep their own status
        if (ex instanceof ErrorResponse errorResponse) {
            log.warn("Request rejected: {}", ex.getMessage());
            String detail = errorResponse.getBody().getDetail();
            return ResponseEntity.status(errorResponse.getStatusCode())
                .headers(errorResponse.getHeaders())
                .body(Map.of("detail", detail != null ? detail : ex.getMessage()));
        }

        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);

        String detail = ex.getMessage() != null ? ex.getMessage() : ex.toString();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            Map.of("detail", detail)
        );
    }

    private static Map<String, String> toDetail(FieldError error) {
        String message = error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid value";
        return Map.of("field", error.getField(), "message", message);
    }
}
