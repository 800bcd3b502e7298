package com.github.dimitryivaniuta.paydispatch.queue;

import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import com.github.dimitryivaniuta.paydispatch.error.UnsupportedQueueOperationException;
import java.util.List;

/**
 * Transport abstraction over the external asynchronous queue.
 *
 * <p>Implementations hand messages over and return; they never wait for downstream processing
 * and never retry. Delivery guarantees beyond the hand-over belong to the queue itself.</p>
 */
public interface PaymentQueueClient {

    /**
     * Largest number of messages {@link #sendBatch(List)} accepts in one call.
     */
    int MAX_BATCH_ITEMS = 10;

    /**
     * @return transport name, e.g. {@code sqs}
     */
    String provider();

    /**
     * Sends a single message.
     *
     * @param message message
     * @return transport-assigned message id
     * @throws QueueUnavailableException when the transport fails
     */
    String send(QueueMessage message);

    /**
     * Sends one delivery chunk of at most {@link #MAX_BATCH_ITEMS} messages.
     *
     * @param chunk messages
     * @return one outcome per message, matched by {@link QueueMessage#id()}
     * @throws QueueUnavailableException when the whole call fails
     */
    List<SendOutcome> sendBatch(List<QueueMessage> chunk);

    /**
     * Reads approximate queue depth.
     *
     * @return metrics
     * @throws UnsupportedQueueOperationException when the transport has no such notion
     */
    QueueMetrics metrics();
}
