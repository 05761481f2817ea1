package com.contentdesk.backend.modules.permission.presentation;

import java.util.List;

import com.contentdesk.backend.global.web.PageResponse;
import com.contentdesk.backend.modules.permission.application.PermissionService;
import com.contentdesk.backend.modules.permission.application.PermissionService.CreatePermissionCommand;
import com.contentdesk.backend.modules.permission.application.PermissionService.DeletedFilter;
import com.contentdesk.backend.modules.permission.application.PermissionService.PermissionQuery;
import com.contentdesk.backend.modules.permission.application.PermissionService.UpdatePermissionCommand;
import com.contentdesk.backend.modules.permission.presentation.dto.BulkOperationResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.BulkPermissionRequest;
import com.contentdesk.backend.modules.permission.presentation.dto.CreatePermissionRequest;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionOptionGroupResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionStatsResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.UpdatePermissionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/permissions")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @Operation(summary = "권한 목록 조회", description = "검색, 정렬, 삭제 상태 필터를 지원한다. admin:full_access는 노출되지 않는다.")
    @GetMapping
    public ResponseEntity<PageResponse<PermissionResponse>> list(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder,
            @RequestParam(name = "deleted", defaultValue = "false") boolean deleted,
            @RequestParam(name = "includeDeleted", defaultValue = "false") boolean includeDeleted
    ) {
        DeletedFilter filter = includeDeleted ? DeletedFilter.ALL : deleted ? DeletedFilter.DELETED : DeletedFilter.ACTIVE;
        PermissionQuery query = new PermissionQuery(page, limit, search, sortBy, sortOrder, filter);
        return ResponseEntity.ok(permissionService.list(query));
    }

    @GetMapping("/deleted")
    public ResponseEntity<PageResponse<PermissionResponse>> listDeleted(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder
    ) {
        PermissionQuery query = new PermissionQuery(page, limit, search, sortBy, sortOrder, DeletedFilter.DELETED);
        return ResponseEntity.ok(permissionService.list(query));
    }

    @GetMapping("/stats")
    public ResponseEntity<PermissionStatsResponse> stats() {
        return ResponseEntity.ok(permissionService.stats());
    }

    @Operation(summary = "권한 선택지 조회", description = "리소스별로 묶은 활성 권한 목록. 인증 없이 호출할 수 있다.")
    @GetMapping("/options")
    public ResponseEntity<List<PermissionOptionGroupResponse>> options() {
        return ResponseEntity.ok(permissionService.options());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PermissionResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(permissionService.get(id));
    }

    @Operation(summary = "권한 생성")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "생성 성공"),
            @ApiResponse(responseCode = "400", description = "resource:action 형식 위반"),
            @ApiResponse(responseCode = "409", description = "이름 중복 또는 예약된 권한")
    })
    @PostMapping
    public ResponseEntity<PermissionResponse> create(@Valid @RequestBody CreatePermissionRequest request) {
        PermissionResponse created = permissionService.create(new CreatePermissionCommand(
                request.name(),
                request.description(),
                request.metaTitle(),
                request.metaDescription()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PermissionResponse> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdatePermissionRequest request
    ) {
        PermissionResponse updated = permissionService.update(id, new UpdatePermissionCommand(
                request.name(),
                request.description(),
                request.metaTitle(),
                request.metaDescription()
        ));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<PermissionResponse> softDelete(@PathVariable Long id) {
        return ResponseEntity.ok(permissionService.softDelete(id));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<PermissionResponse> restore(@PathVariable Long id) {
        return ResponseEntity.ok(permissionService.restore(id));
    }

    @Operation(summary = "권한 영구 삭제", description = "어떤 역할도 참조하지 않는 권한만 삭제할 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "삭제 성공"),
            @ApiResponse(responseCode = "409", description = "역할이 참조 중")
    })
    @DeleteMapping("/{id}/permanent")
    public ResponseEntity<Void> permanentDelete(@PathVariable Long id) {
        permissionService.permanentDelete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/bulk/delete")
    public ResponseEntity<BulkOperationResponse> bulkDelete(@Valid @RequestBody BulkPermissionRequest request) {
        return ResponseEntity.ok(permissionService.bulkDelete(request.ids()));
    }

    @PostMapping("/bulk/restore")
    public ResponseEntity<BulkOperationResponse> bulkRestore(@Valid @RequestBody BulkPermissionRequest request) {
        return ResponseEntity.ok(permissionService.bulkRestore(request.ids()));
    }

    @PostMapping("/bulk/permanent-delete")
    public ResponseEntity<BulkOperationResponse> bulkPermanentDelete(@Valid @RequestBody BulkPermissionRequest request) {
        return ResponseEntity.ok(permissionService.bulkPermanentDelete(request.ids()));
    }
}
