package com.contentdesk.backend.modules.user.application;

import java.util.Collection;
import java.util.List;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.modules.user.domain.AppUser;
import com.contentdesk.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.contentdesk.backend.modules.user.presentation.dto.UserPermissionsResponse;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class UserPermissionService {

    private final AppUserRepository appUserRepository;

    public UserPermissionService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    public UserPermissionsResponse getPermissions(@NonNull Long userId) {
        AppUser user = findUser(userId);
        Role role = user.getRole();
        String roleName = role != null && !role.isDeleted() ? role.getName() : null;
        return new UserPermissionsResponse(userId, roleName, permissionNames(user));
    }

    /**
     * Flattened permission names of the user's role; empty without a role.
     */
    public List<String> permissionNames(@NonNull Long userId) {
        return permissionNames(findUser(userId));
    }

    public boolean hasPermission(@NonNull Long userId, String permission) {
        List<String> granted = permissionNames(userId);
        return granted.contains(PermissionCatalog.SUPER_ADMIN) || granted.contains(permission);
    }

    public boolean hasAnyPermission(@NonNull Long userId, Collection<String> permissions) {
        List<String> granted = permissionNames(userId);
        return granted.contains(PermissionCatalog.SUPER_ADMIN) || permissions.stream().anyMatch(granted::contains);
    }

    public boolean hasAllPermissions(@NonNull Long userId, Collection<String> permissions) {
        List<String> granted = permissionNames(userId);
        return granted.contains(PermissionCatalog.SUPER_ADMIN) || granted.containsAll(permissions);
    }

    private List<String> permissionNames(AppUser user) {
        if (user.getRole() == null) {
            return List.of();
        }
        return appUserRepository.findEffectivePermissionNames(user.getId());
    }

    private AppUser findUser(Long userId) {
        return appUserRepository.findActiveWithRole(userId)
                .orElseThrow(() -> ProblemException.notFound("user.not_found", "사용자를 찾을 수 없습니다: " + userId));
    }
}
