package com.github.dimitryivaniuta.paydispatch.domain;

/**
 * Payment status stored as a string in the database.
 */
public enum PaymentStatus {
    /** Payment completed. Default for every submission. */
    PAID,

    /** Payment awaiting settlement. */
    PENDING,

    /** Payment failed. */
    FAILED
}
