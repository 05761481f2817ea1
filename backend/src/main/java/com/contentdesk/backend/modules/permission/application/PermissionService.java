package com.contentdesk.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.contentdesk.backend.global.error.ProblemException;
import com.contentdesk.backend.global.web.PageResponse;
import com.contentdesk.backend.modules.permission.domain.Permission;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.contentdesk.backend.modules.permission.presentation.dto.BulkOperationResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionOptionGroupResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionStatsResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;
    public static final int MAX_BULK_SIZE = 50;
    private static final String DEFAULT_SORT = "createdAt";
    private static final Set<String> SORTABLE_FIELDS = Set.of("id", "name", "description", "createdAt", "updatedAt", "deletedAt");

    private final PermissionRepository permissionRepository;
    private final Clock clock;

    public PermissionService(PermissionRepository permissionRepository, Clock clock) {
        this.permissionRepository = permissionRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PageResponse<PermissionResponse> list(PermissionQuery query) {
        int page = query.page() == null || query.page() < 1 ? DEFAULT_PAGE : query.page();
        int limit = query.limit() == null || query.limit() < 1 ? DEFAULT_LIMIT : Math.min(query.limit(), MAX_LIMIT);
        String sortField = query.sortBy() != null && SORTABLE_FIELDS.contains(query.sortBy()) ? query.sortBy() : DEFAULT_SORT;
        Sort.Direction direction = "asc".equalsIgnoreCase(query.sortOrder()) ? Sort.Direction.ASC : Sort.Direction.DESC;
        DeletedFilter filter = query.deletedFilter() == null ? DeletedFilter.ACTIVE : query.deletedFilter();

        Page<Permission> result = permissionRepository.search(
                PermissionCatalog.SUPER_ADMIN,
                filter != DeletedFilter.DELETED,
                filter != DeletedFilter.ACTIVE,
                likePattern(query.search()),
                PageRequest.of(page - 1, limit, Sort.by(direction, sortField).and(Sort.by(Sort.Direction.ASC, "id")))
        );
        return PageResponse.from(result, PermissionResponse::from);
    }

    @Transactional(readOnly = true)
    public PermissionResponse get(@NonNull Long id) {
        return PermissionResponse.from(findVisible(id));
    }

    public PermissionResponse create(CreatePermissionCommand command) {
        String name = normalizeName(command.name());
        ensureAssignableName(name);
        if (permissionRepository.existsByName(name)) {
            throw duplicateName(name);
        }
        Permission permission = new Permission(name, trimToNull(command.description()));
        permission.setMetaTitle(trimToNull(command.metaTitle()));
        permission.setMetaDescription(trimToNull(command.metaDescription()));
        Permission saved = permissionRepository.save(permission);
        log.info("Permission created: {} (id={})", saved.getName(), saved.getId());
        return PermissionResponse.from(saved);
    }

    public PermissionResponse update(@NonNull Long id, UpdatePermissionCommand command) {
        Permission permission = findMutable(id);
        if (command.name() != null) {
            String name = normalizeName(command.name());
            if (!name.equals(permission.getName())) {
                ensureAssignableName(name);
                if (permissionRepository.existsByName(name)) {
                    throw duplicateName(name);
                }
                permission.setName(name);
            }
        }
        if (command.description() != null) {
            permission.setDescription(trimToNull(command.description()));
        }
        if (command.metaTitle() != null) {
            permission.setMetaTitle(trimToNull(command.metaTitle()));
        }
        if (command.metaDescription() != null) {
            permission.setMetaDescription(trimToNull(command.metaDescription()));
        }
        return PermissionResponse.from(permission);
    }

    /**
     * Marks the permission deleted. Roles keep their link; deleted permissions stop granting
     * access at the next request.
     */
    public PermissionResponse softDelete(@NonNull Long id) {
        Permission permission = findMutable(id);
        if (permission.isDeleted()) {
            throw notFound(id);
        }
        permission.markDeleted(OffsetDateTime.now(clock));
        return PermissionResponse.from(permission);
    }

    public PermissionResponse restore(@NonNull Long id) {
        Permission permission = findMutable(id);
        if (!permission.isDeleted()) {
            throw ProblemException.notFound("permission.not_deleted", "삭제되지 않은 권한은 복구할 수 없습니다.");
        }
        permission.restore();
        return PermissionResponse.from(permission);
    }

    public void permanentDelete(@NonNull Long id) {
        Permission permission = findMutable(id);
        long referencingRoles = permissionRepository.countReferencingRoles(permission.getId());
        if (referencingRoles > 0) {
            throw ProblemException.conflict("permission.in_use",
                    "권한을 사용 중인 역할이 " + referencingRoles + "개 있어 영구 삭제할 수 없습니다.");
        }
        permissionRepository.delete(permission);
        log.info("Permission permanently deleted: {} (id={})", permission.getName(), id);
    }

    public BulkOperationResponse bulkDelete(List<Long> ids) {
        return runBulk(ids, this::softDelete);
    }

    public BulkOperationResponse bulkRestore(List<Long> ids) {
        return runBulk(ids, this::restore);
    }

    public BulkOperationResponse bulkPermanentDelete(List<Long> ids) {
        return runBulk(ids, this::permanentDelete);
    }

    @Transactional(readOnly = true)
    public PermissionStatsResponse stats() {
        String sentinel = PermissionCatalog.SUPER_ADMIN;
        return new PermissionStatsResponse(
                permissionRepository.countByNameNot(sentinel),
                permissionRepository.countByNameNotAndDeletedAtIsNull(sentinel),
                permissionRepository.countByNameNotAndDeletedAtIsNotNull(sentinel)
        );
    }

    /**
     * Active permissions grouped by their resource part, for pickers. The reserved permission is
     * never offered.
     */
    @Transactional(readOnly = true)
    public List<PermissionOptionGroupResponse> options() {
        Map<String, List<PermissionOptionGroupResponse.Option>> grouped = new LinkedHashMap<>();
        for (Permission permission : permissionRepository.findByDeletedAtIsNullAndNameNotOrderByNameAsc(PermissionCatalog.SUPER_ADMIN)) {
            grouped.computeIfAbsent(PermissionCatalog.displayGroupOf(permission.getName()), key -> new ArrayList<>())
                    .add(new PermissionOptionGroupResponse.Option(permission.getId(), permission.getName()));
        }
        return grouped.entrySet().stream()
                .map(entry -> new PermissionOptionGroupResponse(entry.getKey(), List.copyOf(entry.getValue())))
                .toList();
    }

    private BulkOperationResponse runBulk(List<Long> ids, Consumer<Long> operation) {
        if (ids == null || ids.isEmpty()) {
            throw ProblemException.badRequest("permission.bulk_empty", "처리할 권한 ID를 하나 이상 지정해야 합니다.");
        }
        if (ids.size() > MAX_BULK_SIZE) {
            throw ProblemException.badRequest("permission.bulk_too_large",
                    "한 번에 최대 " + MAX_BULK_SIZE + "개까지 처리할 수 있습니다.");
        }
        List<Long> succeeded = new ArrayList<>();
        List<BulkOperationResponse.Failure> failed = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(ids)) {
            try {
                operation.accept(id);
                succeeded.add(id);
            } catch (ProblemException ex) {
                failed.add(new BulkOperationResponse.Failure(id, ex.getCode(), ex.getDetailMessage()));
            }
        }
        return new BulkOperationResponse(ids.size(), succeeded, failed);
    }

    private Permission findVisible(Long id) {
        Permission permission = permissionRepository.findById(id).orElseThrow(() -> notFound(id));
        if (permission.isReserved()) {
            throw notFound(id);
        }
        return permission;
    }

    private Permission findMutable(Long id) {
        Permission permission = permissionRepository.findById(id).orElseThrow(() -> notFound(id));
        if (permission.isReserved()) {
            throw reserved();
        }
        return permission;
    }

    private void ensureAssignableName(String name) {
        if (!PermissionCatalog.isWellFormed(name)) {
            throw ProblemException.badRequest("permission.invalid_name",
                    "권한 이름은 resource:action 형식이어야 합니다.");
        }
        if (PermissionCatalog.isReserved(name)) {
            throw reserved();
        }
    }

    private String normalizeName(String name) {
        return name == null ? "" : name.trim();
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return "%";
        }
        String escaped = search.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private ProblemException notFound(Long id) {
        return ProblemException.notFound("permission.not_found", "권한을 찾을 수 없습니다: " + id);
    }

    private ProblemException duplicateName(String name) {
        return ProblemException.conflict("permission.duplicate_name", "이미 존재하는 권한 이름입니다: " + name);
    }

    private ProblemException reserved() {
        return ProblemException.conflict("permission.reserved", "예약된 권한은 변경할 수 없습니다.");
    }

    public enum DeletedFilter {
        ACTIVE,
        DELETED,
        ALL
    }

    public record PermissionQuery(
            Integer page,
            Integer limit,
            String search,
            String sortBy,
            String sortOrder,
            DeletedFilter deletedFilter
    ) {
    }

    public record CreatePermissionCommand(String name, String description, String metaTitle, String metaDescription) {
    }

    public record UpdatePermissionCommand(String name, String description, String metaTitle, String metaDescription) {
    }
}
