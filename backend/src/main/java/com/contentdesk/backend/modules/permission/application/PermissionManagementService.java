package com.contentdesk.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.contentdesk.backend.modules.permission.domain.DefaultRoleTemplate;
import com.contentdesk.backend.modules.permission.domain.Permission;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository.PermissionRoleCount;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionCategoryResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionHolderResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.PermissionSummaryResponse;
import com.contentdesk.backend.modules.permission.presentation.dto.SyncResultResponse;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.contentdesk.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Keeps the stored permissions in line with {@link PermissionCatalog} and answers the
 * administrative overview queries.
 */
@Service
public class PermissionManagementService {

    private static final Logger log = LoggerFactory.getLogger(PermissionManagementService.class);

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final AppUserRepository appUserRepository;
    private final TransactionTemplate itemTransaction;
    private final TransactionTemplate readTransaction;
    private final Clock clock;

    public PermissionManagementService(
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            AppUserRepository appUserRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.appUserRepository = appUserRepository;
        this.itemTransaction = new TransactionTemplate(transactionManager);
        this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Upserts every catalog permission by name. Each name commits on its own so one failure does
     * not undo the rest; failures are reported in {@link SyncResultResponse#errors()}.
     */
    public SyncResultResponse syncCatalog() {
        int created = 0;
        int updated = 0;
        List<String> errors = new ArrayList<>();
        for (String name : PermissionCatalog.allPermissions()) {
            try {
                Boolean wasCreated = itemTransaction.execute(status -> upsert(name));
                if (Boolean.TRUE.equals(wasCreated)) {
                    created++;
                } else {
                    updated++;
                }
            } catch (DataAccessException | TransactionException ex) {
                log.warn("Permission sync failed for {}", name, ex);
                errors.add(name + ": " + ex.getMostSpecificCause().getMessage());
            }
        }
        log.info("Permission catalog sync finished: created={}, updated={}, errors={}", created, updated, errors.size());
        return new SyncResultResponse(created, updated, List.copyOf(errors), 0);
    }

    /**
     * Creates the template roles that do not exist yet. Existing roles are left untouched.
     *
     * @return number of roles created
     */
    public int provisionDefaultRoles() {
        Integer created = itemTransaction.execute(status -> {
            int count = 0;
            for (DefaultRoleTemplate template : DefaultRoleTemplate.defaults()) {
                if (roleRepository.existsByName(template.name())) {
                    continue;
                }
                Role role = new Role(template.name(), template.description());
                List<Permission> granted = new ArrayList<>();
                for (String permissionName : template.permissions()) {
                    Optional<Permission> permission = permissionRepository.findByName(permissionName);
                    if (permission.isPresent()) {
                        granted.add(permission.get());
                    } else {
                        log.warn("Default role {} references unknown permission {}", template.name(), permissionName);
                    }
                }
                role.replacePermissions(granted);
                roleRepository.save(role);
                count++;
                log.info("Provisioned default role {} with {} permissions", template.name(), granted.size());
            }
            return count;
        });
        return created == null ? 0 : created;
    }

    public SyncResultResponse syncAndProvision() {
        SyncResultResponse sync = syncCatalog();
        int roles = provisionDefaultRoles();
        return new SyncResultResponse(sync.created(), sync.updated(), sync.errors(), roles);
    }

    public List<PermissionCategoryResponse> permissionsByCategory() {
        return readTransaction.execute(status -> {
            Map<Long, Long> roleCounts = permissionRepository.countActiveRolesPerPermission().stream()
                    .collect(Collectors.toMap(PermissionRoleCount::getPermissionId, PermissionRoleCount::getRoleCount));
            Map<String, List<PermissionCategoryResponse.Item>> grouped = new LinkedHashMap<>();
            for (Permission permission : permissionRepository.findByDeletedAtIsNullAndNameNotOrderByNameAsc(PermissionCatalog.SUPER_ADMIN)) {
                grouped.computeIfAbsent(PermissionCatalog.resourceOf(permission.getName()), key -> new ArrayList<>())
                        .add(new PermissionCategoryResponse.Item(
                                permission.getId(),
                                permission.getName(),
                                permission.getDescription(),
                                roleCounts.getOrDefault(permission.getId(), 0L)
                        ));
            }
            return grouped.entrySet().stream()
                    .map(entry -> new PermissionCategoryResponse(entry.getKey(), List.copyOf(entry.getValue())))
                    .toList();
        });
    }

    public PermissionSummaryResponse summary() {
        return readTransaction.execute(status -> {
            Map<String, Long> perCategory = permissionRepository
                    .findByDeletedAtIsNullAndNameNotOrderByNameAsc(PermissionCatalog.SUPER_ADMIN).stream()
                    .collect(Collectors.groupingBy(
                            permission -> PermissionCatalog.resourceOf(permission.getName()),
                            TreeMap::new,
                            Collectors.counting()
                    ));
            return new PermissionSummaryResponse(
                    permissionRepository.countByNameNotAndDeletedAtIsNull(PermissionCatalog.SUPER_ADMIN),
                    roleRepository.countByDeletedAtIsNull(),
                    appUserRepository.countByDeletedAtIsNull(),
                    perCategory,
                    roleRepository.countActiveWithoutPermissions(),
                    appUserRepository.countByDeletedAtIsNullAndRoleIsNull()
            );
        });
    }

    public List<PermissionHolderResponse> holdersOf(String permissionName) {
        return readTransaction.execute(status -> appUserRepository.findActiveHoldersOf(permissionName).stream()
                .map(user -> new PermissionHolderResponse(
                        user.getId(),
                        user.getEmail(),
                        user.getName(),
                        user.getRole().getName()
                ))
                .toList());
    }

    private boolean upsert(String name) {
        Optional<Permission> existing = permissionRepository.findByName(name);
        if (existing.isPresent()) {
            existing.get().touch(OffsetDateTime.now(clock));
            return false;
        }
        permissionRepository.save(new Permission(name, PermissionCatalog.defaultDescription(name)));
        return true;
    }
}
