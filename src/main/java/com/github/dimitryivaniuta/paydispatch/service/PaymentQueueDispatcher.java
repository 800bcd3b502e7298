package com.github.dimitryivaniuta.paydispatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import com.github.dimitryivaniuta.paydispatch.queue.PaymentBatching;
import com.github.dimitryivaniuta.paydispatch.queue.PaymentQueueClient;
import com.github.dimitryivaniuta.paydispatch.queue.QueueMessage;
import com.github.dimitryivaniuta.paydispatch.queue.QueueMetrics;
import com.github.dimitryivaniuta.paydispatch.queue.SendOutcome;
import com.github.dimitryivaniuta.paydispatch.service.BatchEnqueueResult.ItemResult;
import com.github.dimitryivaniuta.paydispatch.service.events.PaymentIntentMessage;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Forwards payment intents to the external queue.
 *
 * <p>Fire-and-forget from the application's point of view: a message counts as accepted once the
 * transport took it. Nothing is retried here; transport failures reach the caller unchanged.</p>
 */
@Service
public class PaymentQueueDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PaymentQueueDispatcher.class);

    static final String SCHEMA_VERSION = "1";

    private final PaymentQueueClient queueClient;
    private final PaymentIntentValidator validator;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;

    private final Counter enqueuedCounter;
    private final Counter failedCounter;

    /**
     * Creates the dispatcher.
     *
     * @param queueClient   active queue transport
     * @param validator     intent validator
     * @param objectMapper  jackson mapper
     * @param properties    app properties
     * @param meterRegistry metrics
     */
    public PaymentQueueDispatcher(
            PaymentQueueClient queueClient,
            PaymentIntentValidator validator,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.queueClient = queueClient;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.properties = properties;

        this.enqueuedCounter = Counter.builder("payments.queue.enqueued").register(meterRegistry);
        this.failedCounter = Counter.builder("payments.queue.failed").register(meterRegistry);
    }

    /**
     * Validates an intent and hands it to the queue.
     *
     * @param intent intent
     * @return transport-assigned message id
     */
    public String enqueue(PaymentIntent intent) {
        return send(validator.validate(intent), null);
    }

    /**
     * Forwards an intent that was already validated and stored as payment {@code paymentId}.
     *
     * @param intent    normalized intent
     * @param paymentId stored payment id
     * @return transport-assigned message id
     */
    public String enqueueStored(PaymentIntent intent, Long paymentId) {
        return send(intent, paymentId);
    }

    /**
     * Hands a list of intents to the queue in delivery chunks of at most {@code app.queue.batch-size}.
     *
     * <p>Invalid intents are rejected individually and never sent. A failed chunk rejects every
     * item in it; other chunks are unaffected.</p>
     *
     * @param intents intents in request order
     * @return per-item outcome
     */
    public BatchEnqueueResult enqueueBatch(List<PaymentIntent> intents) {
        ItemResult[] results = new ItemResult[intents.size()];
        List<QueueMessage> messages = new ArrayList<>(intents.size());
        Map<String, Integer> indexById = new HashMap<>();

        for (int i = 0; i < intents.size(); i++) {
            try {
                QueueMessage message = toMessage(validator.validate(intents.get(i)), null);
                messages.add(message);
                indexById.put(message.id(), i);
            } catch (PaymentValidationException e) {
                results[i] = ItemResult.rejected(i, e.getMessage());
            }
        }

        List<List<QueueMessage>> chunks = PaymentBatching.chunk(messages, properties.getQueue().getBatchSize());
        for (List<QueueMessage> chunk : chunks) {
            try {
                for (SendOutcome outcome : queueClient.sendBatch(chunk)) {
                    int index = indexById.get(outcome.id());
                    results[index] = outcome.isSuccess()
                            ? ItemResult.accepted(index, outcome.messageId())
                            : ItemResult.rejected(index, outcome.error());
                }
            } catch (QueueUnavailableException e) {
                log.warn("Queue chunk of {} messages failed on {}: {}", chunk.size(), queueClient.provider(), e.getMessage());
                for (QueueMessage message : chunk) {
                    int index = indexById.get(message.id());
                    results[index] = ItemResult.rejected(index, e.getMessage());
                }
            }
        }

        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                results[i] = ItemResult.rejected(i, "No result returned by " + queueClient.provider());
            }
        }

        int accepted = (int) Arrays.stream(results).filter(ItemResult::isAccepted).count();
        int rejected = results.length - accepted;
        enqueuedCounter.increment(accepted);
        failedCounter.increment(rejected);

        log.info("Batch enqueue done. provider={} items={} chunks={} accepted={} rejected={}",
                queueClient.provider(), results.length, chunks.size(), accepted, rejected);
        return new BatchEnqueueResult(accepted, rejected, List.of(results));
    }

    /**
     * Reads queue depth from the active transport.
     *
     * @return metrics
     */
    public QueueMetrics metrics() {
        return queueClient.metrics();
    }

    private String send(PaymentIntent intent, Long paymentId) {
        QueueMessage message = toMessage(intent, paymentId);
        try {
            String messageId = queueClient.send(message);
            enqueuedCounter.increment();
            log.info("Payment intent queued. provider={} messageId={} userId={}",
                    queueClient.provider(), messageId, intent.userId());
            return messageId;
        } catch (QueueUnavailableException e) {
            failedCounter.increment();
            log.warn("Payment intent not queued. provider={} userId={} error={}",
                    queueClient.provider(), intent.userId(), e.getMessage());
            throw e;
        }
    }

    private QueueMessage toMessage(PaymentIntent intent, Long paymentId) {
        String messageId = UUID.randomUUID().toString();
        PaymentIntentMessage payload = new PaymentIntentMessage(
                SCHEMA_VERSION,
                messageId,
                Instant.now(),
                paymentId,
                intent.userId(),
                intent.amount(),
                intent.currency(),
                intent.description()
        );
        return new QueueMessage(messageId, String.valueOf(intent.userId()), toJson(payload));
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize queue payload", e);
        }
    }
}
