package com.chambua.pricing.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps Flyway the only writer of the catalog schema.
 *
 * Outside a test profile, startup is refused when Hibernate would create, drop or alter tables
 * ({@code ddl-auto} create, create-drop or update) or when Flyway is switched off. The price
 * history is append-only and cannot be rebuilt once a schema change loses it.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    static final Set<String> SCHEMA_WRITING_DDL = Set.of("create", "create-drop", "create-only", "drop", "update");

    private final Environment environment;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifySchemaOwnership() {
        List<String> profiles = Arrays.asList(environment.getActiveProfiles());
        String ddlAuto = environment.getProperty("spring.jpa.hibernate.ddl-auto", "none");
        boolean flywayEnabled = environment.getProperty("spring.flyway.enabled", Boolean.class, true);
        String url = environment.getProperty("spring.datasource.url", "");

        log.info("[DB_SAFETY] profiles={} ddl-auto={} flyway={} datasource={}", profiles, ddlAuto, flywayEnabled, url);
        List<String> problems = problems(profiles, ddlAuto, flywayEnabled);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Refusing to start against the price catalog: " + String.join("; ", problems));
        }
        if (url.toLowerCase(Locale.ROOT).contains(":mem:")) {
            log.warn("[DB_SAFETY] In-memory database: catalog and price history are lost on restart");
        }
    }

    /**
     * @return why the settings would let something other than Flyway change the schema; empty when safe
     */
    static List<String> problems(List<String> activeProfiles, String ddlAuto, boolean flywayEnabled) {
        boolean test = activeProfiles.stream().anyMatch(p -> p.toLowerCase(Locale.ROOT).contains("test"));
        List<String> out = new ArrayList<>();
        if (test) return out;
        String ddl = ddlAuto == null ? "none" : ddlAuto.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (SCHEMA_WRITING_DDL.contains(ddl)) {
            out.add("spring.jpa.hibernate.ddl-auto=" + ddlAuto + " lets Hibernate change tables that Flyway owns");
        }
        if (!flywayEnabled) {
            out.add("spring.flyway.enabled=false leaves the schema unmigrated");
        }
        return out;
    }
}
