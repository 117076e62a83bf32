package com.carbondna.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * CarbonDNA emission integrity ledger.
 *
 * Hash-chained emission records, daily Merkle anchors and tamper verification.
 */
@SpringBootApplication(scanBasePackages = "com.carbondna")
@EntityScan(basePackages = "com.carbondna.core.domain")
@EnableJpaRepositories(basePackages = "com.carbondna.core.repository")
public class CarbonDnaApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarbonDnaApiApplication.class, args);
    }
}
