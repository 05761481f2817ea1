package com.contentdesk.backend.modules.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.modules.permission.application.PermissionService;
import com.contentdesk.backend.modules.permission.application.PermissionService.CreatePermissionCommand;
import com.contentdesk.backend.modules.permission.application.PermissionService.UpdatePermissionCommand;
import com.contentdesk.backend.modules.permission.domain.Permission;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.contentdesk.backend.modules.permission.presentation.dto.BulkOperationResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionOptionGroupResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class PermissionServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private PermissionRepository permissionRepository;

    private PermissionService permissionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        permissionService = new PermissionService(permissionRepository, clock);
        lenient().when(permissionRepository.save(any(Permission.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void createTrimsAndSaves() {
        when(permissionRepository.existsByName("reports:export")).thenReturn(false);

        PermissionResponse created = permissionService.create(
                new CreatePermissionCommand("  reports:export ", " Export reports ", null, "  "));

        assertThat(created.name()).isEqualTo("reports:export");
        assertThat(created.description()).isEqualTo("Export reports");
        assertThat(created.metaDescription()).isNull();
    }

    @Test
    @DisplayName("resource:action 형식이 아니면 400을 반환한다")
    void createRejectsNameWithoutColon() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> permissionService.create(new CreatePermissionCommand("reports", null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getCode()).isEqualTo("permission.invalid_name");
        verify(permissionRepository, never()).save(any());
    }

    @Test
    @DisplayName("소프트 삭제된 권한과 이름이 같아도 생성은 충돌로 거부된다")
    void createConflictsEvenWithSoftDeletedName() {
        when(permissionRepository.existsByName("blogs:archive")).thenReturn(true);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> permissionService.create(new CreatePermissionCommand("blogs:archive", null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCode()).isEqualTo("permission.duplicate_name");
    }

    @Test
    void createRejectsReservedName() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> permissionService.create(new CreatePermissionCommand(PermissionCatalog.SUPER_ADMIN, null, null, null)));

        assertThat(ex.getCode()).isEqualTo("permission.reserved");
    }

    @Test
    @DisplayName("예약 권한은 조회 시 404, 수정 시 409로 처리된다")
    void sentinelIsHiddenAndImmutable() {
        Permission sentinel = permission(1L, PermissionCatalog.SUPER_ADMIN);
        when(permissionRepository.findById(1L)).thenReturn(Optional.of(sentinel));

        ProblemException onGet = assertThrows(ProblemException.class, () -> permissionService.get(1L));
        ProblemException onUpdate = assertThrows(ProblemException.class,
                () -> permissionService.update(1L, new UpdatePermissionCommand(null, "changed", null, null)));
        ProblemException onDelete = assertThrows(ProblemException.class, () -> permissionService.softDelete(1L));

        assertThat(onGet.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(onUpdate.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(onDelete.getCode()).isEqualTo("permission.reserved");
    }

    @Test
    void updateChecksUniquenessOnlyWhenRenamed() {
        Permission permission = permission(5L, "tags:create");
        when(permissionRepository.findById(5L)).thenReturn(Optional.of(permission));

        permissionService.update(5L, new UpdatePermissionCommand("tags:create", "Create tags", null, null));

        verify(permissionRepository, never()).existsByName(anyString());
        assertThat(permission.getDescription()).isEqualTo("Create tags");
    }

    @Test
    void softDeleteThenRestore() {
        Permission permission = permission(6L, "tags:delete");
        when(permissionRepository.findById(6L)).thenReturn(Optional.of(permission));

        PermissionResponse deleted = permissionService.softDelete(6L);
        assertThat(deleted.deletedAt()).isEqualTo(NOW);

        ProblemException again = assertThrows(ProblemException.class, () -> permissionService.softDelete(6L));
        assertThat(again.getCode()).isEqualTo("permission.not_found");

        PermissionResponse restored = permissionService.restore(6L);
        assertThat(restored.deletedAt()).isNull();

        ProblemException notDeleted = assertThrows(ProblemException.class, () -> permissionService.restore(6L));
        assertThat(notDeleted.getCode()).isEqualTo("permission.not_deleted");
    }

    @Test
    @DisplayName("역할이 참조 중인 권한은 영구 삭제할 수 없다")
    void permanentDeleteRejectsReferencedPermission() {
        Permission permission = permission(7L, "media:update");
        when(permissionRepository.findById(7L)).thenReturn(Optional.of(permission));
        when(permissionRepository.countReferencingRoles(7L)).thenReturn(2L);

        ProblemException ex = assertThrows(ProblemException.class, () -> permissionService.permanentDelete(7L));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCode()).isEqualTo("permission.in_use");
        verify(permissionRepository, never()).delete(any());
    }

    @Test
    void bulkRejectsEmptyAndOversizedInput() {
        ProblemException empty = assertThrows(ProblemException.class, () -> permissionService.bulkDelete(List.of()));
        List<Long> tooMany = LongStream.rangeClosed(1, PermissionService.MAX_BULK_SIZE + 1).boxed().toList();
        ProblemException large = assertThrows(ProblemException.class, () -> permissionService.bulkDelete(tooMany));

        assertThat(empty.getCode()).isEqualTo("permission.bulk_empty");
        assertThat(large.getCode()).isEqualTo("permission.bulk_too_large");
    }

    @Test
    @DisplayName("일괄 삭제는 항목별로 독립 처리되어 실패 항목만 보고한다")
    void bulkDeleteReportsPerItemFailures() {
        when(permissionRepository.findById(10L)).thenReturn(Optional.of(permission(10L, "tags:read")));
        when(permissionRepository.findById(11L)).thenReturn(Optional.empty());
        when(permissionRepository.findById(12L)).thenReturn(Optional.of(permission(12L, "tags:update")));

        BulkOperationResponse response = permissionService.bulkDelete(List.of(10L, 11L, 12L));

        assertThat(response.requested()).isEqualTo(3);
        assertThat(response.succeeded()).containsExactly(10L, 12L);
        assertThat(response.failed()).singleElement()
                .satisfies(failure -> {
                    assertThat(failure.id()).isEqualTo(11L);
                    assertThat(failure.code()).isEqualTo("permission.not_found");
                });
    }

    @Test
    void optionsAreGroupedByResource() {
        when(permissionRepository.findByDeletedAtIsNullAndNameNotOrderByNameAsc(PermissionCatalog.SUPER_ADMIN))
                .thenReturn(List.of(
                        permission(1L, "blogs:create"),
                        permission(2L, "blogs:read"),
                        permission(3L, "media:read")
                ));

        List<PermissionOptionGroupResponse> options = permissionService.options();

        assertThat(options).extracting(PermissionOptionGroupResponse::group).containsExactly("Blogs", "Media");
        assertThat(options.get(0).options()).extracting(PermissionOptionGroupResponse.Option::label)
                .containsExactly("blogs:create", "blogs:read");
    }

    private static Permission permission(Long id, String name) {
        Permission permission = new Permission(name, PermissionCatalog.defaultDescription(name));
        try {
            java.lang.reflect.Field idField = Permission.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(permission, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
        return permission;
    }
}
