package com.contentdesk.backend.modules.role.presentation;

import java.util.List;

import com.contentdesk.backend.modules.role.application.RolePermissionService;
import com.contentdesk.backend.modules.role.presentation.dto.RolePermissionChangeRequest;
import com.contentdesk.backend.modules.role.presentation.dto.RolePermissionsResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/roles")
public class RolePermissionController {

    private final RolePermissionService rolePermissionService;

    public RolePermissionController(RolePermissionService rolePermissionService) {
        this.rolePermissionService = rolePermissionService;
    }

    @GetMapping("/permissions")
    public ResponseEntity<List<RolePermissionsResponse>> listRoles() {
        return ResponseEntity.ok(rolePermissionService.listRoles());
    }

    @GetMapping("/{id}/permissions")
    public ResponseEntity<RolePermissionsResponse> getRole(@PathVariable Long id) {
        return ResponseEntity.ok(rolePermissionService.getRole(id));
    }

    @Operation(summary = "역할 권한 교체", description = "전달한 권한 ID 목록으로 역할의 권한 전체를 교체한다.")
    @PutMapping("/{id}/permissions")
    public ResponseEntity<RolePermissionsResponse> assign(
            @PathVariable Long id,
            @Valid @RequestBody RolePermissionChangeRequest request
    ) {
        return ResponseEntity.ok(rolePermissionService.assignPermissions(id, request.permissionIds()));
    }

    @Operation(summary = "역할 권한 제거")
    @PostMapping("/{id}/permissions/remove")
    public ResponseEntity<RolePermissionsResponse> remove(
            @PathVariable Long id,
            @Valid @RequestBody RolePermissionChangeRequest request
    ) {
        return ResponseEntity.ok(rolePermissionService.removePermissions(id, request.permissionIds()));
    }
}
