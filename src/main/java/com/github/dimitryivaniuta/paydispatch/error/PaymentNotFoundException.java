package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * No payment with the requested id.
 */
public class PaymentNotFoundException extends PaymentApiException {

    public static final String CODE = "NOT_FOUND";

    public PaymentNotFoundException(Long paymentId) {
        super(CODE, HttpStatus.NOT_FOUND, "Payment " + paymentId + " not found", null);
    }
}
