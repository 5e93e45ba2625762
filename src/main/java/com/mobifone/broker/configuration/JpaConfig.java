package com.mobifone.broker.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Clock;
import java.util.Optional;

/**
 * Audit columns on broker entities. Timestamps come from the shared {@link Clock} so that
 * instance ages and TTL checks agree with what is written to the database.
 */
@Configuration
@EnableJpaAuditing(auditorAwareRef = "brokerAuditor", dateTimeProviderRef = "brokerAuditClock")
public class JpaConfig {

    /** Recorded for writes made by the provisioning listener and other background work. */
    static final String BROKER_AUDITOR = "broker";

    @Bean
    public AuditorAware<String> brokerAuditor() {
        return () -> {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication == null || !authentication.isAuthenticated() || authentication.getName() == null) {
                return Optional.of(BROKER_AUDITOR);
            }
            return Optional.of(authentication.getName());
        };
    }

    @Bean
    public DateTimeProvider brokerAuditClock(Clock clock) {
        return () -> Optional.of(clock.instant());
    }
}
