package com.github.dimitryivaniuta.paydispatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Application-level configuration properties.
 *
 * <p>Bound once from {@code app.*} instead of sprinkling {@code @Value} across the codebase.</p>
 */
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private final Payments payments = new Payments();

    @Valid
    private final Queue queue = new Queue();

    @Getter
    @Setter
    public static class Payments {
        /**
         * Currency used when the intent carries none.
         */
        @NotBlank
        private String defaultCurrency = "INR";

        /**
         * Forward every stored payment to the queue right after it is persisted.
         */
        private boolean enqueueOnSubmit = false;

        /**
         * Upper bound (and default) for the latest-payments listing.
         */
        @Min(1)
        private int latestLimit = 1000;

        /**
         * TTL of cached payment lookups.
         */
        private Duration cacheTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Queue {
        /**
         * Active transport: {@code sqs} or {@code kafka}.
         */
        @NotBlank
        private String provider = "sqs";

        /**
         * Max number of messages per delivery chunk. Both transports cap a batch at 10 entries.
         */
        @Min(1)
        @Max(10)
        private int batchSize = 10;

        private final Sqs sqs = new Sqs();
        private final Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Sqs {
        /**
         * Target queue URL. A URL ending in {@code .fifo} switches on message group ids.
         */
        private String queueUrl;

        /**
         * AWS region of the queue.
         */
        private String region = "us-east-1";

        /**
         * Optional endpoint override (LocalStack etc.).
         */
        private String endpoint;
    }

    @Getter
    @Setter
    public static class Kafka {
        /**
         * Kafka topic for payment intents.
         */
        private String topic = "payment-intents";

        /**
         * Number of partitions used when the topic is created by the application.
         */
        private int partitions = 6;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);
    }
}
