package com.github.dimitryivaniuta.paydispatch;

import com.github.dimitryivaniuta.paydispatch.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Application entry point for the Payment Dispatch API.
 */
@SpringBootApplication
@EnableCaching
@EnableConfigurationProperties(AppProperties.class)
public class PaymentDispatchApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(PaymentDispatchApplication.class, args);
    }
}
