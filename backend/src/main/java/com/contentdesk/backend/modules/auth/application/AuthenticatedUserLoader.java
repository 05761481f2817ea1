package com.contentdesk.backend.modules.auth.application;

import java.util.LinkedHashSet;
import java.util.Optional;

import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.modules.user.domain.AppUser;
import com.contentdesk.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads the user, role and flattened permission set for a verified token subject.
 * Nothing is cached; every request reads the current state of the store.
 */
@Service
@Transactional(readOnly = true)
public class AuthenticatedUserLoader {

    private final AppUserRepository appUserRepository;

    public AuthenticatedUserLoader(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    /**
     * @return empty when the user no longer exists or has been soft-deleted
     */
    public Optional<AuthenticatedUser> load(Long userId) {
        return appUserRepository.findActiveWithRole(userId).map(this::toAuthenticatedUser);
    }

    private AuthenticatedUser toAuthenticatedUser(AppUser user) {
        Role role = user.getRole();
        boolean activeRole = role != null && !role.isDeleted();
        LinkedHashSet<String> permissions = activeRole
                ? new LinkedHashSet<>(appUserRepository.findEffectivePermissionNames(user.getId()))
                : new LinkedHashSet<>();
        return new AuthenticatedUser(
                user.getId(),
                user.getEmail(),
                activeRole ? role.getName() : null,
                permissions
        );
    }
}
