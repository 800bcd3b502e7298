package com.github.dimitryivaniuta.paydispatch.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A stored payment attempt.
 *
 * <p>Rows are insert-only: nothing in the application updates a payment once it is saved.
 * The id comes from the database identity column, so it is unique and increases with every insert.
 * {@code createdAt} is kept at microsecond precision, the resolution of the Postgres timestamp column.</p>
 */
@Entity
@Table(
        name = "payments",
        indexes = {
                @Index(name = "idx_payments_user_created", columnList = "user_id,created_at"),
                @Index(name = "idx_payments_created", columnList = "created_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, updatable = false, length = 8)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PaymentStatus status;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Factory method for a completed payment.
     *
     * @param userId      paying user
     * @param amount      amount, scale 2
     * @param currency    currency code
     * @param description free text, may be null
     * @return unsaved payment entity
     */
    public static Payment newPaid(Long userId, BigDecimal amount, String currency, String description) {
        Payment p = new Payment();
        p.userId = userId;
        p.amount = amount;
        p.currency = currency;
        p.description = description;
        p.status = PaymentStatus.PAID;
        p.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        return p;
    }
}
