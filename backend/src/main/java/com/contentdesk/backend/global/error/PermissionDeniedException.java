package com.contentdesk.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;

/**
 * 403 응답. 누락된 권한 이름만 노출하고 소유권 판정 결과는 담지 않는다.
 */
public class PermissionDeniedException extends ProblemException {

    public static final String CODE = "permission.denied";

    private final List<String> missingPermissions;

    public PermissionDeniedException(List<String> missingPermissions) {
        super(HttpStatus.FORBIDDEN, CODE, buildDetail(missingPermissions));
        this.missingPermissions = missingPermissions == null ? List.of() : List.copyOf(missingPermissions);
    }

    public List<String> getMissingPermissions() {
        return missingPermissions;
    }

    private static String buildDetail(List<String> missingPermissions) {
        if (missingPermissions == null || missingPermissions.isEmpty()) {
            return "요청한 리소스에 접근할 권한이 없습니다.";
        }
        return "필요한 권한이 없습니다: " + String.join(", ", missingPermissions);
    }
}
