package com.mobifone.broker.service.auth;

public enum AuthenticatorCapability {
    SEARCH_USERS,
    SEARCH_GROUPS,
    CREATE_USERS,
    NEEDS_PASSWORD,
    /** Users live in an outside directory; the broker only mirrors them. */
    EXTERNAL_SOURCE
}
