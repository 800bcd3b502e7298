package com.github.dimitryivaniuta.paydispatch.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Queue payload for a payment intent.
 *
 * <p>{@code paymentId} is set only when the intent was stored before being forwarded.</p>
 */
public record PaymentIntentMessage(
        String schemaVersion,
        String messageId,
        Instant occurredAt,
        Long paymentId,
        Long userId,
        BigDecimal amount,
        String currency,
        String description
) {}
