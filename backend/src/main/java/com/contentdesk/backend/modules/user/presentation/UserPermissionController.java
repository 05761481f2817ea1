package com.contentdesk.backend.modules.user.presentation;

import java.util.List;
import java.util.Locale;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.global.security.SecurityUtils;
import com.contentdesk.backend.modules.user.application.UserPermissionService;
import com.contentdesk.backend.modules.user.presentation.dto.PermissionCheckResponse;
import com.contentdesk.backend.modules.user.presentation.dto.UserPermissionsResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UserPermissionController {

    private final UserPermissionService userPermissionService;

    public UserPermissionController(UserPermissionService userPermissionService) {
        this.userPermissionService = userPermissionService;
    }

    @GetMapping("/me/permissions")
    public ResponseEntity<UserPermissionsResponse> myPermissions() {
        return ResponseEntity.ok(userPermissionService.getPermissions(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/users/{id}/permissions")
    public ResponseEntity<UserPermissionsResponse> userPermissions(@PathVariable Long id) {
        return ResponseEntity.ok(userPermissionService.getPermissions(id));
    }

    @GetMapping("/users/{id}/permissions/check")
    public ResponseEntity<PermissionCheckResponse> check(
            @PathVariable Long id,
            @RequestParam(name = "permission") List<String> permissions,
            @RequestParam(name = "mode", defaultValue = "all") String mode
    ) {
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        boolean granted = switch (normalized) {
            case "all" -> userPermissionService.hasAllPermissions(id, permissions);
            case "any" -> userPermissionService.hasAnyPermission(id, permissions);
            default -> throw ProblemException.badRequest("permission.invalid_check_mode", "mode는 all 또는 any여야 합니다.");
        };
        return ResponseEntity.ok(new PermissionCheckResponse(id, permissions, normalized, granted));
    }
}
