package com.mobifone.broker.service.auth;

import com.mobifone.broker.dto.response.SearchItemResponse;
import com.mobifone.broker.entity.User;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Source of user identities. Each implementation states what it can do through
 * {@link #getCapabilities()}; callers check a capability before using the matching method.
 */
public interface Authenticator {
    String getName();

    String getType();

    Set<AuthenticatorCapability> getCapabilities();

    default boolean supports(AuthenticatorCapability capability) {
        return getCapabilities().contains(capability);
    }

    /** The user when the credentials are valid, empty otherwise. */
    Optional<User> authenticate(String username, String password);

    default List<SearchItemResponse> searchUsers(String term, int limit) {
        throw new UnsupportedOperationException(getName() + " cannot search users");
    }

    default List<SearchItemResponse> searchGroups(String term, int limit) {
        throw new UnsupportedOperationException(getName() + " cannot search groups");
    }
}
