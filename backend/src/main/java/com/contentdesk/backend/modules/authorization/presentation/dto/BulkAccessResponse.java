package com.contentdesk.backend.modules.authorization.presentation.dto;

import java.util.ArrayList;
import java.util.List;

public record BulkAccessResponse(String resourceType, String action, List<Item> results) {

    public static BulkAccessResponse of(String resourceType, String action, List<String> resourceIds, List<Boolean> granted) {
        List<Item> items = new ArrayList<>(resourceIds.size());
        for (int i = 0; i < resourceIds.size(); i++) {
            items.add(new Item(resourceIds.get(i), Boolean.TRUE.equals(granted.get(i))));
        }
        return new BulkAccessResponse(resourceType, action, items);
    }

    public record Item(String resourceId, boolean granted) {
    }
}
