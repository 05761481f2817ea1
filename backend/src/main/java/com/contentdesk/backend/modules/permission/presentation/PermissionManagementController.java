package com.contentdesk.backend.modules.permission.presentation;

import java.util.List;

import com.contentdesk.backend.modules.permission.application.PermissionManagementService;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionCategoryResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionHolderResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionSummaryResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.SyncResultResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/permissions")
public class PermissionManagementController {

    private final PermissionManagementService permissionManagementService;

    public PermissionManagementController(PermissionManagementService permissionManagementService) {
        this.permissionManagementService = permissionManagementService;
    }

    @Operation(summary = "권한 카탈로그 동기화", description = "코드에 정의된 권한을 이름 기준으로 upsert하고 기본 역할을 생성한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "동기화 결과. 항목별 오류는 errors에 담긴다."),
            @ApiResponse(responseCode = "403", description = "admin:full_access 필요")
    })
    @PostMapping("/sync")
    public ResponseEntity<SyncResultResponse> sync() {
        return ResponseEntity.ok(permissionManagementService.syncAndProvision());
    }

    @GetMapping("/by-category")
    public ResponseEntity<List<PermissionCategoryResponse>> byCategory() {
        return ResponseEntity.ok(permissionManagementService.permissionsByCategory());
    }

    @GetMapping("/summary")
    public ResponseEntity<PermissionSummaryResponse> summary() {
        return ResponseEntity.ok(permissionManagementService.summary());
    }

    @GetMapping("/holders/{permissionName}")
    public ResponseEntity<List<PermissionHolderResponse>> holders(@PathVariable String permissionName) {
        return ResponseEntity.ok(permissionManagementService.holdersOf(permissionName));
    }
}
