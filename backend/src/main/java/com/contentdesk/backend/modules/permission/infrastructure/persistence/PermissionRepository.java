package com.contentdesk.backend.modules.permission.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.modules.permission.domain.Permission;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    Optional<Permission> findByName(String name);

    /**
     * Exact, case-sensitive match over every row, soft-deleted ones included.
     */
    boolean existsByName(String name);

    @Query("""
            select p from Permission p
            where p.name <> :excludedName
              and ((:includeActive = true and p.deletedAt is null)
                   or (:includeDeleted = true and p.deletedAt is not null))
              and (lower(p.name) like :pattern escape '\\'
                   or lower(coalesce(p.description, '')) like :pattern escape '\\'
                   or lower(coalesce(p.metaTitle, '')) like :pattern escape '\\'
                   or lower(coalesce(p.metaDescription, '')) like :pattern escape '\\')
            """)
    Page<Permission> search(
            @Param("excludedName") String excludedName,
            @Param("includeActive") boolean includeActive,
            @Param("includeDeleted") boolean includeDeleted,
            @Param("pattern") String pattern,
            Pageable pageable
    );

    List<Permission> findByDeletedAtIsNullAndNameNotOrderByNameAsc(String excludedName);

    List<Permission> findByIdIn(Collection<Long> ids);

    long countByNameNot(String excludedName);

    long countByNameNotAndDeletedAtIsNull(String excludedName);

    long countByNameNotAndDeletedAtIsNotNull(String excludedName);

    @Query("select count(r) from Role r join r.permissions p where p.id = :permissionId")
    long countReferencingRoles(@Param("permissionId") Long permissionId);

    @Query("""
            select p.id as permissionId, count(r) as roleCount
            from Role r join r.permissions p
            where r.deletedAt is null
            group by p.id
            """)
    List<PermissionRoleCount> countActiveRolesPerPermission();

    interface PermissionRoleCount {
        Long getPermissionId();

        long getRoleCount();
    }
}
