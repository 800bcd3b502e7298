package com.github.dimitryivaniuta.paydispatch.service;

import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import com.github.dimitryivaniuta.paydispatch.domain.Payment;
import com.github.dimitryivaniuta.paydispatch.domain.PaymentStatus;
import com.github.dimitryivaniuta.paydispatch.error.PaymentNotFoundException;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.error.QueueUnavailableException;
import com.github.dimitryivaniuta.paydispatch.error.StoreUnavailableException;
import com.github.dimitryivaniuta.paydispatch.repo.PaymentRepository;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

/**
 * Submission and lookup against an in-memory stand-in for the payment repository.
 */
class PaymentSubmissionServiceTest {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, Payment> rows = new HashMap<>();

    private PaymentRepository repository;
    private PaymentQueueDispatcher dispatcher;
    private AppProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private PaymentSubmissionService service;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(PaymentRepository.class);
        dispatcher = Mockito.mock(PaymentQueueDispatcher.class);
        properties = new AppProperties();
        meterRegistry = new SimpleMeterRegistry();

        Mockito.when(repository.saveAndFlush(Mockito.any(Payment.class))).thenAnswer(inv -> {
            Payment p = inv.getArgument(0);
            p.setId(ids.incrementAndGet());
            rows.put(p.getId(), p);
            return p;
        });
        Mockito.when(repository.findById(Mockito.anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<Long>getArgument(0))));

        service = new PaymentSubmissionService(repository, new PaymentIntentValidator(properties), dispatcher, properties, meterRegistry);
    }

    @Test
    void submitStoresPaidPaymentWithInputAmount() {
        PaymentResponse stored = service.submit(new PaymentIntent(32L, new BigDecimal("100.00"), "INR", "treats"));

        Assertions.assertNotNull(stored.id());
        Assertions.assertEquals(32L, stored.userId());
        Assertions.assertEquals(new BigDecimal("100.00"), stored.amount());
        Assertions.assertEquals("INR", stored.currency());
        Assertions.assertEquals(PaymentStatus.PAID.name(), stored.status());
        Assertions.assertEquals("treats", stored.description());
        Assertions.assertNotNull(stored.createdAt());
        Assertions.assertEquals(1.0, meterRegistry.counter("payments.submitted").count());
        Mockito.verify(repository, Mockito.times(1)).saveAndFlush(Mockito.any(Payment.class));
        Mockito.verifyNoInteractions(dispatcher);
    }

    @Test
    void createdAtHasMicrosecondPrecision() {
        PaymentResponse stored = service.submit(new PaymentIntent(32L, new BigDecimal("1.00"), "INR", null));

        Assertions.assertEquals(0, stored.createdAt().getNano() % 1_000);
        Assertions.assertEquals(stored.createdAt(), service.fetch(stored.id()).createdAt());
    }

    @Test
    void idsAreUniqueAcrossSubmissions() {
        Set<Long> seen = new HashSet<>();
        for (int i = 1; i <= 20; i++) {
            PaymentResponse stored = service.submit(new PaymentIntent((long) i, new BigDecimal(i + ".25"), null, null));
            Assertions.assertEquals(new BigDecimal(i + ".25"), stored.amount());
            Assertions.assertTrue(seen.add(stored.id()), "duplicate id " + stored.id());
        }
    }

    @Test
    void submitRejectsNonPositiveAmountWithoutWriting() {
        Assertions.assertThrows(PaymentValidationException.class,
                () -> service.submit(new PaymentIntent(32L, BigDecimal.ZERO, "INR", null)));
        Assertions.assertThrows(PaymentValidationException.class,
                () -> service.submit(new PaymentIntent(32L, new BigDecimal("-5.00"), "INR", null)));

        Mockito.verify(repository, Mockito.never()).saveAndFlush(Mockito.any());
        Assertions.assertEquals(2.0, meterRegistry.counter("payments.rejected").count());
    }

    @Test
    void submitThenFetchRoundTrips() {
        PaymentResponse stored = service.submit(new PaymentIntent(7L, new BigDecimal("12.50"), "usd", "leash"));

        PaymentResponse fetched = service.fetch(stored.id());

        Assertions.assertEquals(stored.amount(), fetched.amount());
        Assertions.assertEquals("USD", fetched.currency());
        Assertions.assertEquals("leash", fetched.description());
    }

    @Test
    void fetchUnknownIdIsNotFound() {
        Assertions.assertThrows(PaymentNotFoundException.class, () -> service.fetch(999L));
    }

    @Test
    void storeFailureSurfacesAsStoreUnavailable() {
        Mockito.doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(repository).saveAndFlush(Mockito.any(Payment.class));

        StoreUnavailableException ex = Assertions.assertThrows(StoreUnavailableException.class,
                () -> service.submit(new PaymentIntent(1L, BigDecimal.TEN, "INR", null)));
        Assertions.assertTrue(ex.getMessage().contains("connection refused"));
        Mockito.verify(repository, Mockito.times(1)).saveAndFlush(Mockito.any(Payment.class));
    }

    @Test
    void enqueueOnSubmitForwardsStoredIntent() {
        properties.getPayments().setEnqueueOnSubmit(true);
        Mockito.when(dispatcher.enqueueStored(Mockito.any(), Mockito.anyLong())).thenReturn("msg-1");

        PaymentResponse stored = service.submit(new PaymentIntent(32L, new BigDecimal("100.00"), null, null));

        ArgumentCaptor<PaymentIntent> intent = ArgumentCaptor.forClass(PaymentIntent.class);
        Mockito.verify(dispatcher).enqueueStored(intent.capture(), Mockito.eq(stored.id()));
        Assertions.assertEquals("INR", intent.getValue().currency());
    }

    @Test
    void queueFailureOnSubmitKeepsStoredRow() {
        properties.getPayments().setEnqueueOnSubmit(true);
        Mockito.when(dispatcher.enqueueStored(Mockito.any(), Mockito.anyLong()))
                .thenThrow(new QueueUnavailableException("queue down", null));

        Assertions.assertThrows(QueueUnavailableException.class,
                () -> service.submit(new PaymentIntent(32L, BigDecimal.ONE, "INR", null)));
        Assertions.assertEquals(1, rows.size());
    }

    @Test
    void latestClampsLimit() {
        Mockito.when(repository.findLatest(Mockito.any(Pageable.class))).thenReturn(List.of());

        service.latest(5000);
        service.latest(0);
        service.latest(null);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        Mockito.verify(repository, Mockito.times(3)).findLatest(page.capture());
        Assertions.assertEquals(List.of(1000, 1, 1000),
                page.getAllValues().stream().map(Pageable::getPageSize).toList());
    }

    @Test
    void historyMapsRowsInRepositoryOrder() {
        Payment older = Payment.newPaid(4L, new BigDecimal("1.00"), "INR", null);
        older.setId(1L);
        Payment newer = Payment.newPaid(4L, new BigDecimal("2.00"), "INR", null);
        newer.setId(2L);
        Mockito.when(repository.findHistory(4L)).thenReturn(List.of(newer, older));

        List<PaymentResponse> history = service.history(4L);

        Assertions.assertEquals(List.of(2L, 1L), history.stream().map(PaymentResponse::id).toList());
    }
}
