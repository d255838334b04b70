package com.vanphong.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under each module's {@code infrastructure} package. Audit timestamps come
 * from the shared UTC {@link Clock}, so {@code created_at}/{@code updated_at} follow the same
 * clock as token issuing.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.vanphong.backend.modules")
@EnableJpaAuditing(auditorAwareRef = "requesterAuditorAware", dateTimeProviderRef = "clockDateTimeProvider")
public class JpaConfig {

    @Bean
    public AuditorAware<UUID> requesterAuditorAware() {
        return new VanphongAuditorAware();
    }

    @Bean
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
    }
}
