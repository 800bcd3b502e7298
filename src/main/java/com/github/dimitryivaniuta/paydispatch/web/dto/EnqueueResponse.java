package com.github.dimitryivaniuta.paydispatch.web.dto;

/**
 * Response returned once an intent was handed to the queue.
 *
 * @param status    always {@code queued}
 * @param messageId transport-assigned message id
 */
public record EnqueueResponse(String status, String messageId) {

    public static EnqueueResponse queued(String messageId) {
        return new EnqueueResponse("queued", messageId);
    }
}
