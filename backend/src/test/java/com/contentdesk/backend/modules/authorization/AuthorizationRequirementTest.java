package com.contentdesk.backend.modules.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;

import org.junit.jupiter.api.Test;

class AuthorizationRequirementTest {

    @Test
    void publicAndAuthenticatedAreDistinct() {
        assertThat(AuthorizationRequirement.publicAccess().isPublic()).isTrue();
        assertThat(AuthorizationRequirement.publicAccess().isAuthenticatedOnly()).isFalse();
        assertThat(AuthorizationRequirement.authenticated().isPublic()).isFalse();
        assertThat(AuthorizationRequirement.authenticated().isAuthenticatedOnly()).isTrue();
    }

    @Test
    void combinatorsKeepEarlierPaths() {
        AuthorizationRequirement requirement = AuthorizationRequirement.requireAll("blogs:update")
                .orAny("blogs:full_access")
                .orOwnership("blogs");

        assertThat(requirement.allOf()).containsExactly("blogs:update");
        assertThat(requirement.anyOf()).containsExactly("blogs:full_access");
        assertThat(requirement.ownershipType()).isEqualTo("blogs");
        assertThat(requirement.requiresOwnership()).isTrue();
        assertThat(requirement.isAuthenticatedOnly()).isFalse();
    }

    @Test
    void equalityIsStructural() {
        assertThat(AuthorizationRequirement.requireAll("a:b").orOwnership("media"))
                .isEqualTo(AuthorizationRequirement.requireAll("a:b").orOwnership("media"))
                .isNotEqualTo(AuthorizationRequirement.requireAll("a:b"));
    }

    @Test
    void rejectsEmptyDeclarations() {
        assertThatThrownBy(AuthorizationRequirement::requireAll).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AuthorizationRequirement.requireOwnership(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
