package com.github.dimitryivaniuta.paydispatch.queue;

/**
 * Outcome of sending one message of a batch. Either {@code messageId} or {@code error} is set.
 *
 * @param id        client-side id of the message
 * @param messageId id assigned by the transport, on success
 * @param error     failure description, on failure
 */
public record SendOutcome(String id, String messageId, String error) {

    public static SendOutcome success(String id, String messageId) {
        return new SendOutcome(id, messageId, null);
    }

    public static SendOutcome failure(String id, String error) {
        return new SendOutcome(id, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
