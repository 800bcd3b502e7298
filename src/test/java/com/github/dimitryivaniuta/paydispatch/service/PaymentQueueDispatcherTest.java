package com.github.dimitryivaniuta.paydispatch.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import com.github.dimitryivaniuta.paydispatch.queue.PaymentQueueClient;
import com.github.dimitryivaniuta.paydispatch.queue.QueueMessage;
import com.github.dimitryivaniuta.paydispatch.queue.SendOutcome;
import com.github.dimitryivaniuta.paydispatch.service.BatchEnqueueResult.ItemResult;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class PaymentQueueDispatcherTest {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .addModule(new JavaTimeModule())
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private final List<Integer> chunkSizes = new ArrayList<>();

    private PaymentQueueClient client;
    private SimpleMeterRegistry meterRegistry;
    private PaymentQueueDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        client = Mockito.mock(PaymentQueueClient.class);
        Mockito.when(client.provider()).thenReturn("test");
        AppProperties properties = new AppProperties();
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new PaymentQueueDispatcher(client, new PaymentIntentValidator(properties), objectMapper, properties, meterRegistry);
    }

    @Test
    void enqueueSerializesNormalizedIntent() throws Exception {
        Mockito.when(client.send(Mockito.any())).thenReturn("sqs-123");

        String messageId = dispatcher.enqueue(new PaymentIntent(32L, new BigDecimal("100"), null, "walk"));

        Assertions.assertEquals("sqs-123", messageId);
        ArgumentCaptor<QueueMessage> sent = ArgumentCaptor.forClass(QueueMessage.class);
        Mockito.verify(client).send(sent.capture());
        Assertions.assertEquals("32", sent.getValue().key());

        JsonNode payload = objectMapper.readTree(sent.getValue().payload());
        Assertions.assertEquals(32L, payload.get("user_id").asLong());
        Assertions.assertTrue(sent.getValue().payload().contains("\"amount\":100.00"), sent.getValue().payload());
        Assertions.assertEquals("INR", payload.get("currency").asText());
        Assertions.assertEquals("walk", payload.get("description").asText());
        Assertions.assertEquals(sent.getValue().id(), payload.get("message_id").asText());
        Assertions.assertTrue(payload.get("payment_id").isNull());
        Assertions.assertEquals(1.0, meterRegistry.counter("payments.queue.enqueued").count());
    }

    @Test
    void enqueueRejectsInvalidIntentWithoutSending() {
        Assertions.assertThrows(PaymentValidationException.class,
                () -> dispatcher.enqueue(new PaymentIntent(1L, new BigDecimal("-1"), "INR", null)));
        Mockito.verify(client, Mockito.never()).send(Mockito.any());
    }

    @Test
    void enqueueSurfacesQueueFailure() {
        Mockito.when(client.send(Mockito.any())).thenThrow(new QueueUnavailableException("throttled", null));

        Assertions.assertThrows(QueueUnavailableException.class,
                () -> dispatcher.enqueue(new PaymentIntent(1L, BigDecimal.TEN, "INR", null)));
        Mockito.verify(client, Mockito.times(1)).send(Mockito.any());
        Assertions.assertEquals(1.0, meterRegistry.counter("payments.queue.failed").count());
    }

    @Test
    void batchOfTwentyFiveIsSentAsTenTenFive() {
        Mockito.when(client.sendBatch(Mockito.anyList())).thenAnswer(inv -> acceptAll(inv.getArgument(0)));

        BatchEnqueueResult result = dispatcher.enqueueBatch(intents(25));

        Assertions.assertEquals(List.of(10, 10, 5), chunkSizes);
        Assertions.assertEquals(25, result.accepted());
        Assertions.assertEquals(0, result.rejected());
        Assertions.assertEquals(25, result.results().size());
        for (int i = 0; i < 25; i++) {
            Assertions.assertEquals(i, result.results().get(i).index());
            Assertions.assertTrue(result.results().get(i).isAccepted());
        }
    }

    @Test
    void failedChunkRejectsOnlyItsOwnItems() {
        Mockito.when(client.sendBatch(Mockito.anyList())).thenAnswer(inv -> {
            List<QueueMessage> chunk = inv.getArgument(0);
            if (chunkSizes.size() == 1) {
                chunkSizes.add(chunk.size());
                throw new QueueUnavailableException("SQS batch send failed: throttled", null);
            }
            return acceptAll(chunk);
        });

        BatchEnqueueResult result = dispatcher.enqueueBatch(intents(25));

        Assertions.assertEquals(List.of(10, 10, 5), chunkSizes);
        Assertions.assertEquals(15, result.accepted());
        Assertions.assertEquals(10, result.rejected());
        IntStream.range(10, 20).forEach(i -> {
            ItemResult item = result.results().get(i);
            Assertions.assertFalse(item.isAccepted());
            Assertions.assertTrue(item.error().contains("throttled"));
        });
        Assertions.assertTrue(result.results().get(9).isAccepted());
        Assertions.assertTrue(result.results().get(20).isAccepted());
    }

    @Test
    void acceptedEqualsSumOfPerChunkSuccesses() {
        Mockito.when(client.sendBatch(Mockito.anyList())).thenAnswer(inv -> {
            List<QueueMessage> chunk = inv.getArgument(0);
            chunkSizes.add(chunk.size());
            List<SendOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < chunk.size(); i++) {
                String id = chunk.get(i).id();
                outcomes.add(i == 0 ? SendOutcome.failure(id, "InvalidMessageContents") : SendOutcome.success(id, "m-" + id));
            }
            return outcomes;
        });

        BatchEnqueueResult result = dispatcher.enqueueBatch(intents(25));

        Assertions.assertEquals(22, result.accepted());
        Assertions.assertEquals(3, result.rejected());
        Assertions.assertEquals("InvalidMessageContents", result.results().get(0).error());
        Assertions.assertEquals("InvalidMessageContents", result.results().get(10).error());
        Assertions.assertEquals("InvalidMessageContents", result.results().get(20).error());
    }

    @Test
    void invalidItemsAreRejectedIndividuallyAndNeverSent() {
        Mockito.when(client.sendBatch(Mockito.anyList())).thenAnswer(inv -> acceptAll(inv.getArgument(0)));
        List<PaymentIntent> intents = intents(25);
        intents.set(4, new PaymentIntent(4L, BigDecimal.ZERO, "INR", null));

        BatchEnqueueResult result = dispatcher.enqueueBatch(intents);

        Assertions.assertEquals(List.of(10, 10, 4), chunkSizes);
        Assertions.assertEquals(24, result.accepted());
        Assertions.assertEquals(1, result.rejected());
        Assertions.assertFalse(result.results().get(4).isAccepted());
        Assertions.assertTrue(result.results().get(5).isAccepted());
    }

    @Test
    void emptyBatchSendsNothing() {
        BatchEnqueueResult result = dispatcher.enqueueBatch(List.of());

        Assertions.assertEquals(0, result.accepted());
        Assertions.assertEquals(0, result.rejected());
        Mockito.verify(client, Mockito.never()).sendBatch(Mockito.anyList());
    }

    private List<SendOutcome> acceptAll(List<QueueMessage> chunk) {
        chunkSizes.add(chunk.size());
        return chunk.stream().map(m -> SendOutcome.success(m.id(), "m-" + m.id())).toList();
    }

    private static List<PaymentIntent> intents(int n) {
        List<PaymentIntent> intents = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            intents.add(new PaymentIntent((long) i, new BigDecimal("10.00").add(BigDecimal.valueOf(i)), "INR", "item " + i));
        }
        return intents;
    }
}
