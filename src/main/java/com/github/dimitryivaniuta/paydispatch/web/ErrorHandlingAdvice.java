package com.github.dimitryivaniuta.paydispatch.web;

import com.github.dimitryivaniuta.paydispatch.error.PaymentApiException;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.web.dto.ErrorResponse;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception mapping for HTTP APIs.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    /**
     * Payment API failures carry their own code and status.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(PaymentApiException.class)
    public ResponseEntity<ErrorResponse> handlePaymentApiException(PaymentApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("{}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(new ErrorResponse(ex.getCode(), ex.getMessage(), Instant.now()));
    }

    /**
     * Validation errors for request DTOs.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(ErrorHandlingAdvice::describe)
                .collect(Collectors.joining("; "));
        return validationError(message.isEmpty() ? "Invalid request" : message);
    }

    /**
     * Unparseable JSON or mistyped values.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return validationError("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return validationError("Invalid value for '" + ex.getName() + "'");
    }

    /**
     * Fallback.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return ResponseEntity.status(status)
                    .body(new ErrorResponse(status.name(), framework.getBody().getDetail(), Instant.now()));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", ex.getMessage(), Instant.now()));
    }

    private static ResponseEntity<ErrorResponse> validationError(String message) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(PaymentValidationException.CODE, message, Instant.now()));
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
