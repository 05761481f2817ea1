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
import com.contentdesk.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.contentdesk.backend.modules.authorization.application.OwnedResourceRegistry;
import com.contentdesk.backend.modules.authorization.application.ResourceAccessService;
import com.contentdesk.backend.modules.authorization.application.ResourceOwnershipResolver;
import com.contentdesk.backend.modules.authorization.domain.GrantPath;
import com.contentdesk.backend.modules.authorization.infrastructure.persistence.OwnerLookupRepository;
import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResourceAccessServiceTest {

    private static final Long EDITOR_ID = 7L;
    private static final Long OTHER_AUTHOR_ID = 99L;

    @Mock
    private OwnerLookupRepository ownerLookupRepository;

    private ResourceAccessService accessService;

    @BeforeEach
    void setUp() {
        Executor direct = Runnable::run;
        ResourceOwnershipResolver resolver = new ResourceOwnershipResolver(new OwnedResourceRegistry(), ownerLookupRepository, direct);
        accessService = new ResourceAccessService(new AuthorizationDecisionEngine(resolver), resolver);
        lenient().when(ownerLookupRepository.findOwnerId(any(), anyLong())).thenReturn(Optional.of(OTHER_AUTHOR_ID));
    }

    @Test
    @DisplayName("blogs:delete 보유자는 남의 글도 단건과 일괄 판정 모두 허용된다")
    void blanketPermissionGrantsSingleAndBulkAlike() {
        AuthenticatedUser editor = user(EDITOR_ID, "blogs:delete");

        assertThat(accessService.evaluate(editor, "blogs", "5", "delete").grantedBy()).isEqualTo(GrantPath.ALL_OF);
        assertThat(accessService.canAccessEach(editor, "blogs", "delete", List.of("5", "6", "7")))
                .containsExactly(true, true, true);
        verify(ownerLookupRepository, never()).findOwnerId(any(), anyLong());
    }

    @Test
    @DisplayName("권한이 없으면 일괄 판정은 항목별 소유권으로 결정되고 단건 판정과 일치한다")
    void withoutPermissionBulkFollowsOwnership() {
        AuthenticatedUser author = user(EDITOR_ID, "blogs:read");
        when(ownerLookupRepository.findOwnerId(OwnedResourceType.BLOGS, 1L)).thenReturn(Optional.of(EDITOR_ID));

        List<Boolean> bulk = accessService.canAccessEach(author, "blogs", "update", List.of("1", "2"));

        assertThat(bulk).containsExactly(true, false);
        assertThat(accessService.canAccess(author, "blogs", "1", "update")).isTrue();
        assertThat(accessService.canAccess(author, "blogs", "2", "update")).isFalse();
    }

    @Test
    void emptyBulkRequestIsEmpty() {
        assertThat(accessService.canAccessEach(user(EDITOR_ID, "blogs:delete"), "blogs", "delete", List.of())).isEmpty();
    }

    private static AuthenticatedUser user(Long id, String... permissions) {
        return new AuthenticatedUser(id, "user" + id + "@example.com", "Editor", Set.of(permissions));
    }
}
