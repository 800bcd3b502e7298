package com.github.dimitryivaniuta.paydispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.paydispatch.web.dto.PaymentResponse;
import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Payment rows are never updated after insert, so lookups by id are cached in Redis.
 * Postgres stays the source of truth; a miss falls through to the repository.</p>
 */
@Configuration
public class CacheConfig {

    /**
     * Cache name for payment lookups by id.
     */
    public static final String PAYMENTS_CACHE = "payments";

    /**
     * Registers the payments cache with JSON values and a TTL on the Boot-managed Redis cache manager.
     * Only applied when {@code spring.cache.type} resolves to redis.
     *
     * @param objectMapper application object mapper
     * @param props        application properties
     * @return customizer
     */
    @Bean
    public RedisCacheManagerBuilderCustomizer paymentsCacheCustomizer(ObjectMapper objectMapper, AppProperties props) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, PaymentResponse.class);

        var paymentsCfg = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(props.getPayments().getCacheTtl())
                .disableCachingNullValues()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return builder -> builder.withCacheConfiguration(PAYMENTS_CACHE, paymentsCfg);
    }
}
