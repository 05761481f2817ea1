package com.contentdesk.backend.global.config;

import com.contentdesk.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under each module's {@code infrastructure} package. Auditing stamps
 * timestamps from the shared clock in {@link TimeConfig} and the acting user id from the
 * security context.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.contentdesk.backend.modules")
@EnableJpaAuditing(auditorAwareRef = "auditorAware", dateTimeProviderRef = TimeConfig.AUDITING_DATE_TIME_PROVIDER)
public class JpaConfig {

    @Bean
    public AuditorAware<Long> auditorAware() {
        return new ContentDeskAuditorAware();
    }
}
