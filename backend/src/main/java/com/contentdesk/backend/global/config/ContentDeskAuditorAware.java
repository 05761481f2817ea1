package com.contentdesk.backend.global.config;

import java.util.Optional;

import com.contentdesk.backend.global.security.AuthenticatedUser;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the numeric id of the authenticated user for JPA auditing.
 * Anonymous and system callers (startup sync) yield {@code Optional.empty()}.
 */
public class ContentDeskAuditorAware implements AuditorAware<Long> {

    @Override
    @NonNull
    public Optional<Long> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.ofNullable(user.userId());
        }
        return Optional.empty();
    }
}
