package com.github.dimitryivaniuta.paydispatch.queue;

import static software.amazon.awssdk.services.sqs.model.QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES;
import static software.amazon.awssdk.services.sqs.model.QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED;
import static software.amazon.awssdk.services.sqs.model.QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE;

import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResultEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * Amazon SQS transport.
 *
 * <p>FIFO queues (URL ending in {@code .fifo}) get the message key as group id and the client-side
 * message id as deduplication id.</p>
 */
public class SqsPaymentQueueClient implements PaymentQueueClient {

    private static final Logger log = LoggerFactory.getLogger(SqsPaymentQueueClient.class);

    static final String PROVIDER = "sqs";
    static final String EVENT_TYPE_ATTRIBUTE = "eventType";
    static final String EVENT_TYPE = "PaymentIntent";
    static final String ATTRIBUTE_DATA_TYPE = "String";

    private final SqsClient sqsClient;
    private final String queueUrl;
    private final boolean fifo;

    /**
     * Creates the client.
     *
     * @param sqsClient shared SQS client
     * @param queueUrl  target queue URL
     */
    public SqsPaymentQueueClient(SqsClient sqsClient, String queueUrl) {
        this.sqsClient = Objects.requireNonNull(sqsClient, "sqsClient");
        this.queueUrl = queueUrl;
        this.fifo = queueUrl != null && queueUrl.endsWith(".fifo");
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String send(QueueMessage message) {
        SendMessageRequest.Builder request = SendMessageRequest.builder()
                .queueUrl(requireQueueUrl())
                .messageBody(message.payload())
                .messageAttributes(attributes());
        if (fifo) {
            request.messageGroupId(message.key()).messageDeduplicationId(message.id());
        }

        try {
            String messageId = sqsClient.sendMessage(request.build()).messageId();
            log.debug("Sent message {} to SQS as {}", message.id(), messageId);
            return messageId;
        } catch (SdkException e) {
            throw new QueueUnavailableException("SQS send failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SendOutcome> sendBatch(List<QueueMessage> chunk) {
        if (chunk.isEmpty()) {
            return List.of();
        }
        if (chunk.size() > MAX_BATCH_ITEMS) {
            throw new IllegalArgumentException("SQS batch holds at most " + MAX_BATCH_ITEMS + " entries, got " + chunk.size());
        }

        List<SendMessageBatchRequestEntry> entries = new ArrayList<>(chunk.size());
        for (QueueMessage message : chunk) {
            SendMessageBatchRequestEntry.Builder entry = SendMessageBatchRequestEntry.builder()
                    .id(message.id())
                    .messageBody(message.payload())
                    .messageAttributes(attributes());
            if (fifo) {
                entry.messageGroupId(message.key()).messageDeduplicationId(message.id());
            }
            entries.add(entry.build());
        }

        SendMessageBatchResponse response;
        try {
            response = sqsClient.sendMessageBatch(SendMessageBatchRequest.builder()
                    .queueUrl(requireQueueUrl())
                    .entries(entries)
                    .build());
        } catch (SdkException e) {
            throw new QueueUnavailableException("SQS batch send failed: " + e.getMessage(), e);
        }

        Map<String, SendOutcome> byId = new HashMap<>();
        for (SendMessageBatchResultEntry ok : response.successful()) {
            byId.put(ok.id(), SendOutcome.success(ok.id(), ok.messageId()));
        }
        for (BatchResultErrorEntry failed : response.failed()) {
            log.warn("SQS rejected batch entry {}: code={} senderFault={} message={}",
                    failed.id(), failed.code(), failed.senderFault(), failed.message());
            byId.put(failed.id(), SendOutcome.failure(failed.id(), failed.code() + ": " + failed.message()));
        }

        List<SendOutcome> outcomes = new ArrayList<>(chunk.size());
        for (QueueMessage message : chunk) {
            outcomes.add(byId.getOrDefault(message.id(),
                    SendOutcome.failure(message.id(), "No result returned for entry")));
        }
        return outcomes;
    }

    @Override
    public QueueMetrics metrics() {
        Map<QueueAttributeName, String> attrs;
        try {
            attrs = sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
                    .queueUrl(requireQueueUrl())
                    .attributeNames(
                            APPROXIMATE_NUMBER_OF_MESSAGES,
                            APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE,
                            APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED)
                    .build()).attributes();
        } catch (SdkException e) {
            throw new QueueUnavailableException("SQS attribute lookup failed: " + e.getMessage(), e);
        }

        return new QueueMetrics(
                PROVIDER,
                count(attrs, APPROXIMATE_NUMBER_OF_MESSAGES),
                count(attrs, APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE),
                count(attrs, APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED));
    }

    private static long count(Map<QueueAttributeName, String> attrs, QueueAttributeName name) {
        String value = attrs.get(name);
        return value == null ? 0L : Long.parseLong(value);
    }

    private static Map<String, MessageAttributeValue> attributes() {
        return Map.of(EVENT_TYPE_ATTRIBUTE, MessageAttributeValue.builder()
                .dataType(ATTRIBUTE_DATA_TYPE)
                .stringValue(EVENT_TYPE)
                .build());
    }

    private String requireQueueUrl() {
        if (queueUrl == null || queueUrl.isBlank()) {
            throw new QueueUnavailableException("SQS queue URL is not configured (app.queue.sqs.queue-url)", null);
        }
        return queueUrl;
    }
}
