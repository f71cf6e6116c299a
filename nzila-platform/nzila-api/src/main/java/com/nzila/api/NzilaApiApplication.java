package com.nzila.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Nzila action engine API.
 *
 * AI-proposed actions are validated, checked against policy, approved, executed through
 * tool adapters and attested, with every step written to a hash-chained audit trail.
 */
@SpringBootApplication(scanBasePackages = "com.nzila")
@EntityScan(basePackages = "com.nzila.core.domain")
@EnableJpaRepositories(basePackages = "com.nzila.core.repository")
public class NzilaApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(NzilaApiApplication.class, args);
    }
}
