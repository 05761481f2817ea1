package com.contentdesk.backend.modules.role.application;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.modules.permission.domain.Permission;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.contentdesk.backend.modules.role.infrastructure.persistence.RoleRepository.RoleUserCount;
import com.contentdesk.backend.modules.role.presentation.dto.RolePermissionsResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 역할별 권한 조회와 할당. 동시 수정은 마지막 쓰기가 반영된다.
 */
@Service
@Transactional
public class RolePermissionService {

    private static final Logger log = LoggerFactory.getLogger(RolePermissionService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;

    public RolePermissionService(RoleRepository roleRepository, PermissionRepository permissionRepository) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
    }

    @Transactional(readOnly = true)
    public List<RolePermissionsResponse> listRoles() {
        Map<Long, Long> userCounts = roleRepository.countActiveUsersPerRole().stream()
                .collect(Collectors.toMap(RoleUserCount::getRoleId, RoleUserCount::getUserCount));
        return roleRepository.findAllActiveWithPermissions().stream()
                .map(role -> toResponse(role, userCounts.getOrDefault(role.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public RolePermissionsResponse getRole(@NonNull Long roleId) {
        Role role = findRole(roleId);
        return toResponse(role, roleRepository.countActiveUsers(roleId));
    }

    /**
     * Replaces the role's permission set. Every id must name an existing, non-deleted,
     * non-reserved permission.
     */
    public RolePermissionsResponse assignPermissions(@NonNull Long roleId, Collection<Long> permissionIds) {
        Set<Long> ids = requireIds(permissionIds);
        Role role = findRole(roleId);

        List<Permission> permissions = permissionRepository.findByIdIn(ids);
        boolean allUsable = permissions.size() == ids.size()
                && permissions.stream().noneMatch(permission -> permission.isDeleted() || permission.isReserved());
        if (!allUsable) {
            throw ProblemException.badRequest("role.invalid_permissions", "Some permissions not found");
        }

        role.replacePermissions(permissions);
        log.info("Role {} permissions replaced with {} entries", roleId, permissions.size());
        return toResponse(role, roleRepository.countActiveUsers(roleId));
    }

    public RolePermissionsResponse removePermissions(@NonNull Long roleId, Collection<Long> permissionIds) {
        Set<Long> ids = requireIds(permissionIds);
        Role role = findRole(roleId);
        role.removePermissions(ids);
        log.info("Removed permissions {} from role {}", ids, roleId);
        return toResponse(role, roleRepository.countActiveUsers(roleId));
    }

    private Set<Long> requireIds(Collection<Long> permissionIds) {
        if (permissionIds == null || permissionIds.isEmpty()) {
            throw ProblemException.badRequest("role.invalid_permissions", "권한 ID 목록이 비어 있습니다.");
        }
        return new LinkedHashSet<>(permissionIds);
    }

    private Role findRole(Long roleId) {
        return roleRepository.findActiveWithPermissions(roleId)
                .orElseThrow(() -> ProblemException.notFound("role.not_found", "역할을 찾을 수 없습니다: " + roleId));
    }

    private RolePermissionsResponse toResponse(Role role, long userCount) {
        List<RolePermissionsResponse.PermissionItem> permissions = role.getPermissions().stream()
                .filter(permission -> !permission.isDeleted())
                .sorted(Comparator.comparing(Permission::getName))
                .map(permission -> new RolePermissionsResponse.PermissionItem(
                        permission.getId(),
                        permission.getName(),
                        permission.getDescription()
                ))
                .toList();
        return new RolePermissionsResponse(role.getId(), role.getName(), role.getDescription(), permissions, userCount);
    }
}
