package com.github.dimitryivaniuta.paydispatch.error;

import org.springframework.http.HttpStatus;

/**
 * The external queue rejected or could not receive a message.
 */
public class QueueUnavailableException extends PaymentApiException {

    public static final String CODE = "QUEUE_UNAVAILABLE";

    public QueueUnavailableException(String message, Throwable cause) {
        super(CODE, HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
