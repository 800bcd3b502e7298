package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * The payment record store failed to read or write.
 */
public class StoreUnavailableException extends PaymentApiException {

    public static final String CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message, Throwable cause) {
        super(CODE, HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
