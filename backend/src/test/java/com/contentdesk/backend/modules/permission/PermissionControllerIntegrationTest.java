package com.contentdesk.backend.modules.permission;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;

import com.contentdesk.backend.modules.permission.domain.Permission;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;
import com.contentdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.contentdesk.backend.modules.role.domain.Role;
import com.contentdesk.backend.support.AbstractPostgresIntegrationTest;
import com.contentdesk.backend.support.TestAccountFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class PermissionControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestAccountFactory accounts;

    @Autowired
    private PermissionRepository permissionRepository;

    private String adminToken;

    @BeforeEach
    void setUp() {
        Role manager = accounts.createRole("Permission Manager",
                "roles:read", "roles:create", "roles:update", "roles:delete", "roles:restore", "roles:full_access");
        adminToken = accounts.tokenFor(accounts.createUser("pm@example.com", manager));
    }

    @Test
    @DisplayName("소프트 삭제된 권한과 같은 이름으로 생성하면 409를 반환한다")
    void createConflictsWithSoftDeletedName() throws Exception {
        Permission existing = accounts.ensurePermission("reports:export");

        mockMvc.perform(delete("/permissions/{id}", existing.getId()).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedAt").isNotEmpty());

        mockMvc.perform(post("/permissions")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"reports:export"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("permission.duplicate_name"));
    }

    @Test
    void createRejectsMalformedName() throws Exception {
        mockMvc.perform(post("/permissions")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"reports"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("permission.invalid_name"));
    }

    @Test
    void listSearchesAndHidesDeleted() throws Exception {
        accounts.ensurePermission("reports:export");
        Permission archived = accounts.ensurePermission("reports:archive");
        mockMvc.perform(delete("/permissions/{id}", archived.getId()).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk());

        mockMvc.perform(get("/permissions")
                        .param("search", "REPORTS")
                        .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.total").value(1))
                .andExpect(jsonPath("$.data[0].name").value("reports:export"));

        mockMvc.perform(get("/permissions/deleted").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("reports:archive"));

        mockMvc.perform(get("/permissions/stats").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(1));
    }

    @Test
    @DisplayName("예약 권한은 소프트 삭제 상태여도 삭제 포함 목록에 나타나지 않는다")
    void softDeletedSentinelStaysHidden() throws Exception {
        Permission sentinel = accounts.ensurePermission(PermissionCatalog.SUPER_ADMIN);
        sentinel.markDeleted(OffsetDateTime.now());
        permissionRepository.save(sentinel);
        accounts.ensurePermission("reports:export");

        mockMvc.perform(get("/permissions")
                        .param("includeDeleted", "true")
                        .param("limit", "100")
                        .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[?(@.name == 'admin:full_access')]").isEmpty())
                .andExpect(jsonPath("$.data[?(@.name == 'reports:export')]").isNotEmpty());

        mockMvc.perform(get("/permissions/deleted").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.total").value(0));

        mockMvc.perform(get("/permissions/stats").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(0));
    }

    @Test
    @DisplayName("역할이 참조 중인 권한의 영구 삭제는 409, 참조가 없으면 204")
    void permanentDeleteRespectsRoleReferences() throws Exception {
        Permission inUse = accounts.ensurePermission("roles:read");
        Permission unused = accounts.ensurePermission("reports:purge");

        mockMvc.perform(delete("/permissions/{id}/permanent", inUse.getId()).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("permission.in_use"));

        mockMvc.perform(delete("/permissions/{id}/permanent", unused.getId()).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isNoContent());
    }

    @Test
    void bulkDeleteReportsPartialFailure() throws Exception {
        Permission first = accounts.ensurePermission("reports:a");
        Permission second = accounts.ensurePermission("reports:b");

        mockMvc.perform(post("/permissions/bulk/delete")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ids":[%d,%d,123456]}
                                """.formatted(first.getId(), second.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requested").value(3))
                .andExpect(jsonPath("$.succeeded.length()").value(2))
                .andExpect(jsonPath("$.failed[0].code").value("permission.not_found"));
    }
}
