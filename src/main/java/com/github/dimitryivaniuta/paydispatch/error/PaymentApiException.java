package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * Base class of every failure the payment API reports to its callers.
 *
 * <p>Carries a machine-readable code and the HTTP status it maps to. Nothing in the application
 * retries on these; they are surfaced to the caller as-is.</p>
 */
public abstract class PaymentApiException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected PaymentApiException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    /**
     * @return machine-readable error code
     */
    public String getCode() {
        return code;
    }

    /**
     * @return HTTP status the error maps to
     */
    public HttpStatus getStatus() {
        return status;
    }
}
