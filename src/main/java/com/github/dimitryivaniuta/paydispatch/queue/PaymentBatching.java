package com.github.dimitryivaniuta.paydispatch.queue;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits messages into delivery chunks for {@link PaymentQueueClient#sendBatch(List)}.
 *
 * <p>Every chunk holds at most {@code maxItems} messages whose payloads plus message attributes
 * add up to at most {@link #MAX_BATCH_BYTES}. A single message above the byte limit travels alone, so the
 * transport rejects just that entry. Input order is preserved: 25 messages with
 * {@code maxItems = 10} give chunks of 10, 10 and 5.</p>
 */
@Slf4j
public final class PaymentBatching {

    /**
     * SQS limit on the summed payload size of one batch call.
     */
    public static final int MAX_BATCH_BYTES = 256 * 1024;

    /**
     * Bytes SQS counts for the {@code eventType} message attribute sent with every entry
     * (name, data type and value).
     */
    static final int MESSAGE_ATTRIBUTE_BYTES = (SqsPaymentQueueClient.EVENT_TYPE_ATTRIBUTE
            + SqsPaymentQueueClient.ATTRIBUTE_DATA_TYPE
            + SqsPaymentQueueClient.EVENT_TYPE).getBytes(UTF_8).length;

    private PaymentBatching() {
    }

    /**
     * Chunks messages.
     *
     * @param messages messages in submission order
     * @param maxItems max messages per chunk, 1..{@link PaymentQueueClient#MAX_BATCH_ITEMS}
     * @return chunks, empty when there is nothing to send
     */
    public static List<List<QueueMessage>> chunk(List<QueueMessage> messages, int maxItems) {
        if (maxItems < 1 || maxItems > PaymentQueueClient.MAX_BATCH_ITEMS) {
            throw new IllegalArgumentException("maxItems must be within 1.." + PaymentQueueClient.MAX_BATCH_ITEMS + ": " + maxItems);
        }

        List<List<QueueMessage>> chunks = new ArrayList<>();
        List<QueueMessage> current = new ArrayList<>();
        int currentBytes = 0;

        for (QueueMessage message : messages) {
            int size = sizeOf(message);
            if (size > MAX_BATCH_BYTES) {
                log.warn("Queue message {} exceeds batch size limit. Size is {} bytes.", message.id(), size);
            }
            boolean overBytes = currentBytes + size > MAX_BATCH_BYTES && !current.isEmpty();
            if (overBytes || current.size() >= maxItems) {
                chunks.add(current);
                current = new ArrayList<>();
                currentBytes = 0;
            }
            current.add(message);
            currentBytes += size;
        }

        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    static int sizeOf(QueueMessage message) {
        int payload = message.payload() == null ? 0 : message.payload().getBytes(UTF_8).length;
        return payload + MESSAGE_ATTRIBUTE_BYTES;
    }
}
