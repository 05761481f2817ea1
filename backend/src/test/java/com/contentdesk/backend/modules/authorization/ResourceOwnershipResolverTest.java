package com.contentdesk.backend.modules.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.modules.authorization.application.OwnedResourceRegistry;
import com.contentdesk.backend.modules.authorization.application.ResourceOwnershipResolver;
import com.contentdesk.backend.modules.authorization.domain.OwnershipScope;
import com.contentdesk.backend.modules.authorization.infrastructure.persistence.OwnerLookupRepository;
import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ResourceOwnershipResolverTest {

    private static final Long AUTHOR_ID = 21L;

    @Mock
    private OwnerLookupRepository ownerLookupRepository;

    private ResourceOwnershipResolver resolver;

    @BeforeEach
    void setUp() {
        Executor direct = Runnable::run;
        resolver = new ResourceOwnershipResolver(new OwnedResourceRegistry(), ownerLookupRepository, direct);
        lenient().when(ownerLookupRepository.findOwnerId(any(), anyLong())).thenReturn(Optional.empty());
    }

    @Test
    void resolvesOwnerFromLookup() {
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.MEDIA, 5L)).thenReturn(Optional.of(AUTHOR_ID));

        assertThat(resolver.resolveOwner("media", "5")).contains(AUTHOR_ID);
        assertThat(resolver.isOwnedBy("media", "5", AUTHOR_ID)).isTrue();
        assertThat(resolver.isOwnedBy("media", "5", 99L)).isFalse();
    }

    @Test
    @DisplayName("등록되지 않은 리소스 종류는 조회 없이 소유자 없음으로 처리한다")
    void unknownTypeHasNoOwner() {
        assertThat(resolver.resolveOwner("settings", "1")).isEmpty();
        verify(ownerLookupRepository, never()).findOwnerId(any(), anyLong());
    }

    @Test
    @DisplayName("리소스 종류는 대소문자를 구분하지 않고 blogcomments 별칭도 댓글로 인식한다")
    void typeTagsAreCaseInsensitiveWithAliases() {
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.COMMENTS, 8L)).thenReturn(Optional.of(AUTHOR_ID));
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 9L)).thenReturn(Optional.of(AUTHOR_ID));

        assertThat(resolver.isOwnedBy("blogcomments", "8", AUTHOR_ID)).isTrue();
        assertThat(resolver.isOwnedBy("BlogComments", "8", AUTHOR_ID)).isTrue();
        assertThat(resolver.isOwnedBy("BLOGS", "9", AUTHOR_ID)).isTrue();
        assertThat(resolver.isOwnershipAction("Media", "update")).isTrue();
        assertThat(resolver.canonicalType("blogcomments")).isEqualTo("comments");
        assertThat(resolver.canonicalType("widgets")).isEqualTo("widgets");
    }

    @Test
    void malformedIdHasNoOwner() {
        assertThat(resolver.resolveOwner("blogs", "abc")).isEmpty();
        assertThat(resolver.resolveOwner("blogs", " ")).isEmpty();
        assertThat(resolver.resolveOwner("blogs", null)).isEmpty();
        verify(ownerLookupRepository, never()).findOwnerId(any(), anyLong());
    }

    @Test
    @DisplayName("소유자 조회 중 DB 오류가 나면 소유하지 않은 것으로 본다")
    void lookupFailureMeansNotOwned() {
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 3L))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(resolver.isOwnedBy("blogs", "3", AUTHOR_ID)).isFalse();
    }

    @Test
    @DisplayName("일괄 판정은 요청 순서를 유지하고 항목마다 독립적으로 소유권을 확인한다")
    void bulkResolutionKeepsInputOrder() {
        AuthenticatedUser author = user(AUTHOR_ID, "blogs:read");
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 1L)).thenReturn(Optional.of(AUTHOR_ID));
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 2L)).thenReturn(Optional.of(77L));
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 3L)).thenReturn(Optional.of(AUTHOR_ID));
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 4L)).thenReturn(Optional.empty());
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 5L)).thenReturn(Optional.of(AUTHOR_ID));

        List<Boolean> result = resolver.resolveBulk(author, "blogs", "delete", List.of("1", "2", "3", "4", "5"));

        assertThat(result).containsExactly(true, false, true, false, true);
    }

    @Test
    void bulkResolutionIsolatesFailures() {
        AuthenticatedUser author = user(AUTHOR_ID);
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.COMMENTS, 1L)).thenReturn(Optional.of(AUTHOR_ID));
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.COMMENTS, 2L))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        List<Boolean> result = resolver.resolveBulk(author, "comments", "update", List.of("1", "2"));

        assertThat(result).containsExactly(true, false);
    }

    @Test
    @DisplayName("manage_all 보유자는 조회 없이 모든 항목이 허용된다")
    void manageAllShortCircuitsBulk() {
        AuthenticatedUser moderator = user(30L, "media:manage_all");

        List<Boolean> result = resolver.resolveBulk(moderator, "media", "delete", List.of("1", "2", "3"));

        assertThat(result).containsExactly(true, true, true);
        verify(ownerLookupRepository, never()).findOwnerId(any(), anyLong());
    }

    @Test
    void nonOwnershipActionUsesPlainPermission() {
        AuthenticatedUser viewer = user(31L, "blogs:read");

        assertThat(resolver.resolveBulk(viewer, "blogs", "read", List.of("1", "2"))).containsExactly(true, true);
        assertThat(resolver.resolveBulk(viewer, "blogs", "publish", List.of("1"))).containsExactly(false);
        verify(ownerLookupRepository, never()).findOwnerId(any(), anyLong());
    }

    @Test
    void emptyBulkReturnsEmpty() {
        assertThat(resolver.resolveBulk(user(1L), "blogs", "delete", List.of())).isEmpty();
    }

    @Test
    void scopeDependsOnPermissionsAndType() {
        assertThat(resolver.scopeFor(user(1L, "admin:full_access"), "blogs").kind())
                .isEqualTo(OwnershipScope.Kind.UNRESTRICTED);
        assertThat(resolver.scopeFor(user(1L, "blogs:manage_all"), "blogs").kind())
                .isEqualTo(OwnershipScope.Kind.UNRESTRICTED);

        OwnershipScope own = resolver.scopeFor(user(AUTHOR_ID), "media");
        assertThat(own.toSqlPredicate()).isEqualTo("uploaded_by_id = ?");
        assertThat(own.parameters()).containsExactly(AUTHOR_ID);

        OwnershipScope none = resolver.scopeFor(user(AUTHOR_ID), "settings");
        assertThat(none.toSqlPredicate()).isEqualTo("1 = 0");
        assertThat(none.parameters()).isEmpty();
    }

    private static AuthenticatedUser user(Long id, String... permissions) {
        return new AuthenticatedUser(id, "user" + id + "@example.com", "Author", Set.of(permissions));
    }
}
