package com.contentdesk.backend.modules.authorization.domain;

public enum GrantPath {
    SUPER_ADMIN,
    PUBLIC,
    AUTHENTICATED,
    ALL_OF,
    ANY_OF,
    MANAGE_ALL,
    OWNERSHIP
}
