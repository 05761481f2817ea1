package com.contentdesk.backend.global.security;

import java.util.Collection;
import java.util.Set;

/**
 * 요청 단위로 적재되는 인증 사용자 스냅샷. 권한 집합은 요청마다 저장소에서 새로 읽는다.
 */
public record AuthenticatedUser(Long userId, String email, String roleName, Set<String> permissions) {

    public AuthenticatedUser {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean holds(String permission) {
        return permissions.contains(permission);
    }

    public boolean holdsAll(Collection<String> required) {
        return permissions.containsAll(required);
    }

    public boolean holdsAny(Collection<String> candidates) {
        return candidates.stream().anyMatch(permissions::contains);
    }

    public boolean hasRole() {
        return roleName != null;
    }
}
