package com.contentdesk.backend.modules.permission.application;

import com.contentdesk.backend.modules.permission.presentation.dto.SyncResultResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Syncs the catalog and provisions the default roles once the application is up.
 */
@Component
@ConditionalOnProperty(value = "contentdesk.permissions.sync-on-startup", havingValue = "true")
public class PermissionCatalogInitializer {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalogInitializer.class);

    private final PermissionManagementService permissionManagementService;

    public PermissionCatalogInitializer(PermissionManagementService permissionManagementService) {
        this.permissionManagementService = permissionManagementService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void synchronize() {
        SyncResultResponse result = permissionManagementService.syncAndProvision();
        if (!result.errors().isEmpty()) {
            log.warn("Startup permission sync finished with {} errors: {}", result.errors().size(), result.errors());
        }
        log.info("Startup permission sync: created={}, updated={}, rolesProvisioned={}",
                result.created(), result.updated(), result.rolesProvisioned());
    }
}
