package com.contentdesk.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.modules.user.application.UserPermissionService;
import com.contentdesk.backend.modules.user.domain.AppUser;
import com.contentdesk.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class UserPermissionServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    private UserPermissionService userPermissionService;

    @BeforeEach
    void setUp() {
        userPermissionService = new UserPermissionService(appUserRepository);
    }

    @Test
    void singlePermissionCheckUsesRolePermissions() {
        givenUser(3L, new Role("Author", "Author role"), List.of("blogs:create", "blogs:read"));

        assertThat(userPermissionService.hasPermission(3L, "blogs:create")).isTrue();
        assertThat(userPermissionService.hasPermission(3L, "blogs:delete")).isFalse();
    }

    @Test
    void anyAndAllChecks() {
        givenUser(4L, new Role("Author", "Author role"), List.of("blogs:create", "blogs:read"));

        assertThat(userPermissionService.hasAnyPermission(4L, List.of("blogs:delete", "blogs:read"))).isTrue();
        assertThat(userPermissionService.hasAnyPermission(4L, List.of("blogs:delete", "media:delete"))).isFalse();
        assertThat(userPermissionService.hasAllPermissions(4L, List.of("blogs:create", "blogs:read"))).isTrue();
        assertThat(userPermissionService.hasAllPermissions(4L, List.of("blogs:create", "blogs:delete"))).isFalse();
    }

    @Test
    @DisplayName("admin:full_access 보유자는 어떤 권한 검사든 통과한다")
    void superAdminShortCircuitsEveryCheck() {
        givenUser(1L, new Role("Super Admin", "Super admin role"), List.of(PermissionCatalog.SUPER_ADMIN));

        assertThat(userPermissionService.hasPermission(1L, "settings:update")).isTrue();
        assertThat(userPermissionService.hasAnyPermission(1L, List.of("reports:export"))).isTrue();
        assertThat(userPermissionService.hasAllPermissions(1L, List.of("blogs:delete", "media:delete"))).isTrue();
    }

    @Test
    @DisplayName("역할이 없는 사용자는 권한이 비어 있고 저장소 조회도 하지 않는다")
    void userWithoutRoleHasNothing() {
        AppUser user = user(5L, null);
        when(appUserRepository.findActiveWithRole(5L)).thenReturn(Optional.of(user));

        assertThat(userPermissionService.permissionNames(5L)).isEmpty();
        assertThat(userPermissionService.hasAnyPermission(5L, List.of("blogs:read"))).isFalse();
        assertThat(userPermissionService.getPermissions(5L).roleName()).isNull();
        verify(appUserRepository, never()).findEffectivePermissionNames(anyLong());
    }

    @Test
    void unknownUserIsNotFound() {
        when(appUserRepository.findActiveWithRole(404L)).thenReturn(Optional.empty());

        ProblemException ex = assertThrows(ProblemException.class,
                () -> userPermissionService.hasPermission(404L, "blogs:read"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ex.getCode()).isEqualTo("user.not_found");
    }

    private void givenUser(Long id, Role role, List<String> permissions) {
        AppUser user = user(id, role);
        when(appUserRepository.findActiveWithRole(id)).thenReturn(Optional.of(user));
        when(appUserRepository.findEffectivePermissionNames(id)).thenReturn(permissions);
    }

    private static AppUser user(Long id, Role role) {
        AppUser user = new AppUser("user" + id + "@example.com", "user" + id);
        user.setRole(role);
        try {
            Field idField = AppUser.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(user, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
        return user;
    }
}
