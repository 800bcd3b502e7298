package com.github.dimitryivaniuta.paydispatch.service;

import java.util.List;

/**
 * Per-item outcome of a batch enqueue. Items keep the position they had in the request.
 *
 * @param accepted number of items handed to the queue
 * @param rejected number of items that were not
 * @param results  one entry per requested item, in request order
 */
public record BatchEnqueueResult(int accepted, int rejected, List<ItemResult> results) {

    /**
     * Outcome of a single item.
     *
     * @param index     position in the request
     * @param messageId queue message id when accepted
     * @param error     reason when rejected
     */
    public record ItemResult(int index, String messageId, String error) {

        public static ItemResult accepted(int index, String messageId) {
            return new ItemResult(index, messageId, null);
        }

        public static ItemResult rejected(int index, String error) {
            return new ItemResult(index, null, error);
        }

        public boolean isAccepted() {
            return error == null;
        }
    }
}
