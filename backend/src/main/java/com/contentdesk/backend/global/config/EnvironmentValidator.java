package com.contentdesk.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 인증/인가 관련 필수 설정을 검증한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    // HS256 requires a 256-bit key
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"))
                .map(String::trim)
                .filter(secret -> !secret.isEmpty());
        if (jwtSecret.isEmpty()) {
            problems.add("jwt.secret: 값이 비어 있습니다");
        } else if (jwtSecret.get().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("jwt.secret: 최소 " + MIN_SECRET_BYTES + "바이트 이상이어야 합니다");
        }

        String concurrency = environment.getProperty("contentdesk.ownership.max-concurrency", "8");
        try {
            if (Integer.parseInt(concurrency) <= 0) {
                problems.add("contentdesk.ownership.max-concurrency: 1 이상이어야 합니다");
            }
        } catch (NumberFormatException e) {
            problems.add("contentdesk.ownership.max-concurrency: 숫자여야 합니다");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validation passed");
    }
}
