package com.github.dimitryivaniuta.paydispatch.web.dto;

import com.github.dimitryivaniuta.paydispatch.domain.Payment;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A stored payment as returned by the API.
 */
public record PaymentResponse(
        Long id,
        Long userId,
        BigDecimal amount,
        String currency,
        String status,
        String description,
        Instant createdAt
) {
    /**
     * Maps a domain {@link Payment} to an API response.
     *
     * @param p payment entity
     * @return response
     */
    public static PaymentResponse from(Payment p) {
        return new PaymentResponse(
                p.getId(),
                p.getUserId(),
                p.getAmount(),
                p.getCurrency(),
                p.getStatus().name(),
                p.getDescription(),
                p.getCreatedAt()
        );
    }
}
