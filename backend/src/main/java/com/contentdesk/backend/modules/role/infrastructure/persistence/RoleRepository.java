package com.contentdesk.backend.modules.role.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.modules.role.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    long countByDeletedAtIsNull();

    @Query("select distinct r from Role r left join fetch r.permissions where r.deletedAt is null order by r.id")
    List<Role> findAllActiveWithPermissions();

    @Query("select r from Role r left join fetch r.permissions where r.id = :roleId and r.deletedAt is null")
    Optional<Role> findActiveWithPermissions(@Param("roleId") Long roleId);

    @Query("""
            select count(r) from Role r
            where r.deletedAt is null
              and not exists (
                  select 1 from Role r2 join r2.permissions p
                  where r2 = r and p.deletedAt is null
              )
            """)
    long countActiveWithoutPermissions();

    @Query("""
            select u.role.id as roleId, count(u) as userCount
            from AppUser u
            where u.deletedAt is null and u.role is not null
            group by u.role.id
            """)
    List<RoleUserCount> countActiveUsersPerRole();

    @Query("select count(u) from AppUser u where u.role.id = :roleId and u.deletedAt is null")
    long countActiveUsers(@Param("roleId") Long roleId);

    interface RoleUserCount {
        Long getRoleId();

        long getUserCount();
    }
}
