package com.chambua.pricing.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            try {
                log.info("[Flyway] repair before migrate (clears failed catalog migrations)");
                flyway.repair();
            } catch (Exception ex) {
                log.warn("[Flyway] repair failed or not needed: {}", ex.getMessage());
            }
            flyway.migrate();
            log.info("[Flyway] schema at version {}", currentVersion(flyway));
        };
    }

    private static String currentVersion(Flyway flyway) {
        var current = flyway.info().current();
        return current == null ? "(empty)" : current.getVersion().getVersion();
    }
}
