package com.railexchange.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Rail Exchange API application.
 * Hosts the entitlement, visibility, subscription verification and abuse-prevention services.
 */
@SpringBootApplication(scanBasePackages = "com.railexchange")
@EntityScan(basePackages = "com.railexchange.core.domain")
@EnableJpaRepositories(basePackages = "com.railexchange.core.repository")
@EnableScheduling
public class RailExchangeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RailExchangeApiApplication.class, args);
    }
}
