package com.github.dimitryivaniuta.paydispatch.web;

import com.github.dimitryivaniuta.paydispatch.queue.QueueMetrics;
import com.github.dimitryivaniuta.paydispatch.service.BatchEnqueueResult;
import com.github.dimitryivaniuta.paydispatch.service.PaymentQueueDispatcher;
import com.github.dimitryivaniuta.paydispatch.service.PaymentSubmissionService;
import com.github.dimitryivaniuta.paydispatch.web.dto.EnqueueResponse;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentResponse;
import com.github.dimitryivaniuta.paydispatch.web.dto.SubmitPaymentResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for payments.
 */
@RestController
@RequestMapping("/api/payments")
public class PaymentsController {

    private final PaymentSubmissionService submissionService;
    private final PaymentQueueDispatcher queueDispatcher;

    /**
     * Creates the controller.
     *
     * @param submissionService submission service
     * @param queueDispatcher   queue dispatcher
     */
    public PaymentsController(PaymentSubmissionService submissionService, PaymentQueueDispatcher queueDispatcher) {
        this.submissionService = submissionService;
        this.queueDispatcher = queueDispatcher;
    }

    /**
     * Submits a payment.
     *
     * @param intent payment intent
     * @return submission outcome with the stored id
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SubmitPaymentResponse> submit(@Valid @RequestBody PaymentIntent intent) {
        PaymentResponse stored = submissionService.submit(intent);
        return ResponseEntity.created(URI.create("/api/payments/" + stored.id()))
                .body(new SubmitPaymentResponse(true, stored.id(), "Payment recorded with status " + stored.status()));
    }

    /**
     * Fetches a payment by id.
     *
     * @param paymentId payment id
     * @return payment
     */
    @GetMapping(value = "/{paymentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public PaymentResponse get(@PathVariable Long paymentId) {
        return submissionService.fetch(paymentId);
    }

    @GetMapping(value = "/users/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PaymentResponse> history(@PathVariable Long userId) {
        return submissionService.history(userId);
    }

    /**
     * Latest payments, newest first.
     *
     * @param limit max number of rows, capped at {@code app.payments.latest-limit}
     * @return payments
     */
    @GetMapping(value = "/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PaymentResponse> latest(@RequestParam(required = false) Integer limit) {
        return submissionService.latest(limit);
    }

    /**
     * Hands a payment intent to the queue without storing it.
     *
     * @param intent payment intent
     * @return queued status and message id
     */
    @PostMapping(value = "/queue", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody PaymentIntent intent) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(EnqueueResponse.queued(queueDispatcher.enqueue(intent)));
    }

    /**
     * Hands a list of intents to the queue. Failures are reported per item.
     *
     * @param intents payment intents
     * @return accepted/rejected counts and per-item results
     */
    @PostMapping(value = "/queue/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchEnqueueResult> enqueueBatch(@RequestBody List<PaymentIntent> intents) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queueDispatcher.enqueueBatch(intents));
    }

    @GetMapping(value = "/queue/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public QueueMetrics queueMetrics() {
        return queueDispatcher.metrics();
    }
}
