package com.github.dimitryivaniuta.paydispatch.queue;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import com.github.dimitryivaniuta.paydispatch.error.UnsupportedQueueOperationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Kafka transport.
 *
 * <p>Waits for the broker ack, bounded by {@code sendTimeout}, before reporting a message as sent.
 * The client-side message id travels as the {@code message-id} header and is what callers get back.</p>
 */
public class KafkaPaymentQueueClient implements PaymentQueueClient {

    private static final Logger log = LoggerFactory.getLogger(KafkaPaymentQueueClient.class);

    static final String PROVIDER = "kafka";
    static final String MESSAGE_ID_HEADER = "message-id";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;
    private final Duration sendTimeout;

    /**
     * Creates the client.
     *
     * @param kafkaTemplate template
     * @param topic         target topic
     * @param sendTimeout   ack timeout per message
     */
    public KafkaPaymentQueueClient(KafkaTemplate<String, String> kafkaTemplate, String topic, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String send(QueueMessage message) {
        try {
            await(dispatch(message));
            return message.id();
        } catch (Exception e) {
            throw new QueueUnavailableException("Kafka send to " + topic + " failed: " + describe(e), e);
        }
    }

    @Override
    public List<SendOutcome> sendBatch(List<QueueMessage> chunk) {
        if (chunk.size() > MAX_BATCH_ITEMS) {
            throw new IllegalArgumentException("Batch holds at most " + MAX_BATCH_ITEMS + " entries, got " + chunk.size());
        }

        List<CompletableFuture<SendResult<String, String>>> pending = new ArrayList<>(chunk.size());
        for (QueueMessage message : chunk) {
            try {
                pending.add(dispatch(message));
            } catch (RuntimeException e) {
                pending.add(CompletableFuture.failedFuture(e));
            }
        }

        List<SendOutcome> outcomes = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            QueueMessage message = chunk.get(i);
            try {
                await(pending.get(i));
                outcomes.add(SendOutcome.success(message.id(), message.id()));
            } catch (Exception e) {
                String error = describe(e);
                log.warn("Kafka rejected message {} on topic {}: {}", message.id(), topic, error);
                outcomes.add(SendOutcome.failure(message.id(), error));
            }
        }
        return outcomes;
    }

    @Override
    public QueueMetrics metrics() {
        throw new UnsupportedQueueOperationException("Queue metrics are not available for the kafka provider");
    }

    private CompletableFuture<SendResult<String, String>> dispatch(QueueMessage message) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, message.key(), message.payload());
        record.headers().add(MESSAGE_ID_HEADER, message.id().getBytes(UTF_8));
        return kafkaTemplate.send(record);
    }

    private void await(CompletableFuture<SendResult<String, String>> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String describe(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        String msg = cause.getMessage();
        return msg == null ? cause.getClass().getSimpleName() : msg;
    }
}
