package com.carbondna.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "carbondna.ledger.anchoring", name = "scheduler-enabled",
        havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
