package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * The active queue transport has no notion of the requested operation.
 */
public class UnsupportedQueueOperationException extends PaymentApiException {

    public static final String CODE = "UNSUPPORTED";

    public UnsupportedQueueOperationException(String message) {
        super(CODE, HttpStatus.NOT_IMPLEMENTED, message, null);
    }
}
