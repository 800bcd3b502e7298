package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * Intent rejected before touching the store or the queue (bad amount, currency or user id).
 */
public class PaymentValidationException extends PaymentApiException {

    public static final String CODE = "VALIDATION_ERROR";

    public PaymentValidationException(String message) {
        super(CODE, HttpStatus.BAD_REQUEST, message, null);
    }
}
