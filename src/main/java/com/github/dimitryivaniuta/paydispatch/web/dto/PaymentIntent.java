package com.github.dimitryivaniuta.paydispatch.web.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

/**
 * Client-submitted payment request, unvalidated until it reaches the service.
 *
 * <p>Only presence is checked at the HTTP boundary. Amount and currency rules live in
 * {@code PaymentIntentValidator} so single and batch endpoints accept the same intents.</p>
 *
 * @param userId      paying user, supplied by the upstream identity layer
 * @param amount      positive amount with at most two fraction digits
 * @param currency    currency code; {@code INR} when omitted
 * @param description free text
 */
public record PaymentIntent(
        @NotNull Long userId,
        @NotNull BigDecimal amount,
        String currency,
        String description
) {}
