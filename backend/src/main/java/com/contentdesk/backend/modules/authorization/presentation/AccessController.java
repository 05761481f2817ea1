package com.contentdesk.backend.modules.authorization.presentation;

import java.util.List;

import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.global.security.SecurityUtils;
import com.contentdesk.backend.modules.authorization.application.ResourceAccessService;
import com.contentdesk.backend.modules.authorization.domain.AccessDecision;
import com.contentdesk.backend.modules.authorization.presentation.dto.AccessCheckResponse;
import com.contentdesk.backend.modules.authorization.presentation.dto.BulkAccessRequest;
import com.contentdesk.backend.modules.authorization.presentation.dto.BulkAccessResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets a client ask whether the current caller may act on a resource before offering the action.
 */
@RestController
@RequestMapping("/access")
public class AccessController {

    private final ResourceAccessService resourceAccessService;

    public AccessController(ResourceAccessService resourceAccessService) {
        this.resourceAccessService = resourceAccessService;
    }

    @Operation(summary = "단건 접근 가능 여부", description = "권한 또는 소유권으로 해당 리소스에 action을 수행할 수 있는지 확인한다.")
    @GetMapping("/{resourceType}/{resourceId}")
    public ResponseEntity<AccessCheckResponse> check(
            @PathVariable String resourceType,
            @PathVariable String resourceId,
            @RequestParam(name = "action") String action
    ) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        AccessDecision decision = resourceAccessService.evaluate(user, resourceType, resourceId, action);
        return ResponseEntity.ok(AccessCheckResponse.from(resourceType, resourceId, action, decision));
    }

    @Operation(summary = "다건 접근 가능 여부", description = "요청한 순서대로 리소스별 허용 여부를 반환한다.")
    @PostMapping("/{resourceType}/bulk")
    public ResponseEntity<BulkAccessResponse> checkBulk(
            @PathVariable String resourceType,
            @Valid @RequestBody BulkAccessRequest request
    ) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        List<Boolean> granted = resourceAccessService.canAccessEach(user, resourceType, request.action(), request.resourceIds());
        return ResponseEntity.ok(BulkAccessResponse.of(resourceType, request.action(), request.resourceIds(), granted));
    }
}
