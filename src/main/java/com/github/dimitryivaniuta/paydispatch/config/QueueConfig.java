package com.github.dimitryivaniuta.paydispatch.config;

import com.github.dimitryivaniuta.paydispatch.queue.KafkaPaymentQueueClient;
import com.github.dimitryivaniuta.paydispatch.queue.PaymentQueueClient;
import com.github.dimitryivaniuta.paydispatch.queue.SqsPaymentQueueClient;
import java.net.URI;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

/**
 * Queue transport wiring. Exactly one {@link PaymentQueueClient} is active, selected by
 * {@code app.queue.provider}.
 */
@Configuration
public class QueueConfig {

    /**
     * SQS transport (default).
     */
    @Configuration
    @ConditionalOnProperty(name = "app.queue.provider", havingValue = "sqs", matchIfMissing = true)
    static class SqsQueueConfig {

        /**
         * Shared SQS client handle.
         *
         * @param props application properties
         * @return client
         */
        @Bean(destroyMethod = "close")
        public SqsClient sqsClient(AppProperties props) {
            AppProperties.Sqs sqs = props.getQueue().getSqs();
            SqsClientBuilder builder = SqsClient.builder()
                    .region(Region.of(sqs.getRegion()))
                    .credentialsProvider(DefaultCredentialsProvider.create());
            if (StringUtils.hasText(sqs.getEndpoint())) {
                builder.endpointOverride(URI.create(sqs.getEndpoint()));
            }
            return builder.build();
        }

        @Bean
        public PaymentQueueClient sqsPaymentQueueClient(SqsClient sqsClient, AppProperties props) {
            return new SqsPaymentQueueClient(sqsClient, props.getQueue().getSqs().getQueueUrl());
        }
    }

    /**
     * Kafka transport.
     */
    @Configuration
    @ConditionalOnProperty(name = "app.queue.provider", havingValue = "kafka")
    static class KafkaQueueConfig {

        /**
         * Creates the payment intents topic for local/dev environments.
         *
         * <p>In production the topic is usually provisioned by IaC.</p>
         *
         * @param props application properties
         * @return topic definition
         */
        @Bean
        public NewTopic paymentIntentsTopic(AppProperties props) {
            return TopicBuilder.name(props.getQueue().getKafka().getTopic())
                    .partitions(props.getQueue().getKafka().getPartitions())
                    .replicas(1)
                    .build();
        }

        @Bean
        public PaymentQueueClient kafkaPaymentQueueClient(KafkaTemplate<String, String> kafkaTemplate, AppProperties props) {
            return new KafkaPaymentQueueClient(
                    kafkaTemplate,
                    props.getQueue().getKafka().getTopic(),
                    props.getQueue().getKafka().getSendTimeout());
        }
    }
}
