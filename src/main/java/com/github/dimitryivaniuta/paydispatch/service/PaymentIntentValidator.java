package com.github.dimitryivaniuta.paydispatch.service;

import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import com.github.dimitryivaniuta.paydispatch.error.PaymentValidationException;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentIntent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates and normalizes payment intents.
 *
 * <p>Shared by submission and queue dispatch so both paths accept exactly the same intents.
 * A normalized intent has a currency (defaulted, trimmed, upper-cased) and an amount with scale 2.</p>
 */
@Component
public class PaymentIntentValidator {

    private static final int MAX_INTEGER_DIGITS = 10;
    private static final int MAX_FRACTION_DIGITS = 2;
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{1,8}$");

    private final AppProperties properties;

    /**
     * Creates the validator.
     *
     * @param properties application properties
     */
    public PaymentIntentValidator(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates an intent and returns its normalized form.
     *
     * @param intent raw intent
     * @return normalized intent
     * @throws PaymentValidationException when the intent is unacceptable
     */
    public PaymentIntent validate(PaymentIntent intent) {
        if (intent == null) {
            throw new PaymentValidationException("Payment intent is required");
        }
        if (intent.userId() == null) {
            throw new PaymentValidationException("user_id is required");
        }
        return new PaymentIntent(
                intent.userId(),
                normalizeAmount(intent.amount()),
                normalizeCurrency(intent.currency()),
                intent.description());
    }

    private BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null) {
            throw new PaymentValidationException("amount is required");
        }
        if (amount.signum() <= 0) {
            throw new PaymentValidationException("amount must be greater than 0, got " + amount.toPlainString());
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > MAX_FRACTION_DIGITS) {
            throw new PaymentValidationException("amount must have at most " + MAX_FRACTION_DIGITS + " decimal places");
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new PaymentValidationException("amount must have at most " + MAX_INTEGER_DIGITS + " integer digits");
        }
        return amount.setScale(MAX_FRACTION_DIGITS, RoundingMode.UNNECESSARY);
    }

    private String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return properties.getPayments().getDefaultCurrency();
        }
        String code = currency.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_PATTERN.matcher(code).matches()) {
            throw new PaymentValidationException("currency must be a code of 1 to 8 letters, got '" + currency + "'");
        }
        return code;
    }
}
