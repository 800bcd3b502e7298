package com.github.dimitryivaniuta.paydispatch.service;

import static com.github.dimitryivaniuta.paydispatch.config.CacheConfig.PAYMENTS_CACHE;

import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import com.github.dimitryivaniuta.paydispatch.domain.Payment;
import com.github.dimitryivaniuta.paydispatch.error.PaymentNotFoundException;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.error.StoreUnavailableException;
import com.github.dimitryivaniuta.paydispatch.repo.PaymentRepository;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Business service for payment submission and lookup.
 *
 * <p>One durable write per submission, no retries. Requests share nothing but the pooled store
 * connection and the queue client, so concurrent submissions need no coordination.</p>
 */
@Service
public class PaymentSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(PaymentSubmissionService.class);

    private final PaymentRepository paymentRepository;
    private final PaymentIntentValidator validator;
    private final PaymentQueueDispatcher queueDispatcher;
    private final AppProperties properties;

    private final Counter submittedCounter;
    private final Counter rejectedCounter;

    /**
     * Creates the service.
     *
     * @param paymentRepository payment repository
     * @param validator         intent validator
     * @param queueDispatcher   queue dispatcher, used when enqueue-on-submit is on
     * @param properties        app properties
     * @param meterRegistry     metrics
     */
    public PaymentSubmissionService(
            PaymentRepository paymentRepository,
            PaymentIntentValidator validator,
            PaymentQueueDispatcher queueDispatcher,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.paymentRepository = paymentRepository;
        this.validator = validator;
        this.queueDispatcher = queueDispatcher;
        this.properties = properties;

        this.submittedCounter = Counter.builder("payments.submitted").register(meterRegistry);
        this.rejectedCounter = Counter.builder("payments.rejected").register(meterRegistry);
    }

    /**
     * Validates and stores a payment with status PAID.
     *
     * <p>With {@code app.payments.enqueue-on-submit} the stored intent is forwarded to the queue
     * afterwards. A queue failure then reaches the caller while the stored row stays.</p>
     *
     * @param intent raw intent
     * @return stored payment including id and creation time
     */
    public PaymentResponse submit(PaymentIntent intent) {
        PaymentIntent normalized;
        try {
            normalized = validator.validate(intent);
        } catch (PaymentValidationException e) {
            rejectedCounter.increment();
            throw e;
        }

        Payment saved;
        try {
            saved = paymentRepository.saveAndFlush(Payment.newPaid(
                    normalized.userId(),
                    normalized.amount(),
                    normalized.currency(),
                    normalized.description()));
        } catch (DataAccessException e) {
            log.error("Payment store write failed. userId={} error={}", normalized.userId(), e.getMessage());
            throw new StoreUnavailableException("Payment could not be stored: " + e.getMostSpecificCause().getMessage(), e);
        }

        submittedCounter.increment();
        log.info("Payment stored. paymentId={} userId={} amount={} currency={}",
                saved.getId(), saved.getUserId(), saved.getAmount(), saved.getCurrency());

        if (properties.getPayments().isEnqueueOnSubmit()) {
            queueDispatcher.enqueueStored(normalized, saved.getId());
        }
        return PaymentResponse.from(saved);
    }

    /**
     * Fetches a payment by id.
     *
     * @param paymentId payment id
     * @return payment
     */
    @Cacheable(cacheNames = PAYMENTS_CACHE, key = "#paymentId")
    public PaymentResponse fetch(Long paymentId) {
        try {
            return paymentRepository.findById(paymentId)
                    .map(PaymentResponse::from)
                    .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Payment lookup failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Payment history of a user, newest first.
     *
     * @param userId user id
     * @return payments, possibly empty
     */
    public List<PaymentResponse> history(Long userId) {
        try {
            return paymentRepository.findHistory(userId).stream().map(PaymentResponse::from).toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Payment history lookup failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Latest payments across all users, newest first.
     *
     * @param limit requested size; null means the configured maximum, values are clamped to 1..max
     * @return payments
     */
    public List<PaymentResponse> latest(Integer limit) {
        int max = properties.getPayments().getLatestLimit();
        int size = limit == null ? max : Math.max(1, Math.min(limit, max));
        try {
            return paymentRepository.findLatest(PageRequest.of(0, size)).stream().map(PaymentResponse::from).toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Latest payments lookup failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
