package com.contentdesk.backend.modules.authorization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads the owner column of a content row. This is the only place the authorization module
 * touches content tables.
 */
@Repository
public class OwnerLookupRepository {

    private final JdbcTemplate jdbcTemplate;

    public OwnerLookupRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Long> findOwnerId(OwnedResourceType type, long resourceId) {
        // table and column come from the enum, never from the request
        String sql = "SELECT " + type.ownerColumn() + " FROM " + type.table() + " WHERE id = ?";
        List<Long> owners = jdbcTemplate.query(sql, (rs, rowNum) -> {
            long owner = rs.getLong(1);
            return rs.wasNull() ? null : owner;
        }, resourceId);
        if (owners.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(owners.get(0));
    }
}
