package com.contentdesk.backend.modules.authorization.domain;

/**
 * Resource instance addressed by the request, taken from the path.
 */
public record ResourceTarget(String resourceType, String resourceId) {
}
