package com.github.dimitryivaniuta.paydispatch.web.dto;

/**
 * Response returned for a payment submission.
 *
 * @param success   always {@code true}; failures go through the error response
 * @param paymentId store-assigned id
 * @param message   human readable outcome
 */
public record SubmitPaymentResponse(boolean success, Long paymentId, String message) {}
