package com.contentdesk.backend.modules.user.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.modules.user.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByEmailIgnoreCase(String email);

    @Query("select u from AppUser u left join fetch u.role where u.id = :userId and u.deletedAt is null")
    Optional<AppUser> findActiveWithRole(@Param("userId") Long userId);

    /**
     * Flattened permission names reachable through the user's role. Soft-deleted roles and
     * permissions grant nothing.
     */
    @Query("""
            select p.name
            from AppUser u
              join u.role r
              join r.permissions p
            where u.id = :userId
              and r.deletedAt is null
              and p.deletedAt is null
            order by p.name
            """)
    List<String> findEffectivePermissionNames(@Param("userId") Long userId);

    @Query("""
            select u from AppUser u
              join fetch u.role r
              join r.permissions p
            where p.name = :permissionName
              and u.deletedAt is null
              and r.deletedAt is null
              and p.deletedAt is null
            order by u.id
            """)
    List<AppUser> findActiveHoldersOf(@Param("permissionName") String permissionName);

    long countByDeletedAtIsNull();

    long countByDeletedAtIsNullAndRoleIsNull();
}
