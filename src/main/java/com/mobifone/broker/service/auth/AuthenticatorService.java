package com.mobifone.broker.service.auth;

import com.mobifone.broker.dto.response.AuthenticatorResponse;
import com.mobifone.broker.dto.response.SearchItemResponse;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Registry of the configured authenticators, their type info and directory search. */
@Slf4j
@Service
public class AuthenticatorService {
    static final int MAX_SEARCH_RESULTS = 50;

    private final Map<String, Authenticator> authenticators = new LinkedHashMap<>();

    public AuthenticatorService(List<Authenticator> authenticators) {
        authenticators.stream()
                .sorted(Comparator.comparing(Authenticator::getName))
                .forEach(a -> this.authenticators.put(a.getName(), a));
    }

    public Authenticator get(String name) {
        Authenticator authenticator = name == null ? null : authenticators.get(name);
        if (authenticator == null) {
            throw new AppException(ErrorCode.AUTHENTICATOR_NOT_FOUND);
        }
        return authenticator;
    }

    public List<AuthenticatorResponse> list() {
        return authenticators.values().stream()
                .map(AuthenticatorService::toResponse)
                .collect(Collectors.toList());
    }

    /**
     * @param type "user" or "group"
     * @throws AppException INVALID_REQUEST for another type, NOT_SUPPORTED when the
     *                      authenticator lacks the matching search capability
     */
    public List<SearchItemResponse> search(String name, String type, String term, int limit) {
        Authenticator authenticator = get(name);
        int max = Math.max(1, Math.min(limit, MAX_SEARCH_RESULTS));
        String keyword = term == null ? "" : term.trim();

        List<SearchItemResponse> found;
        if ("user".equalsIgnoreCase(type)) {
            requireCapability(authenticator, AuthenticatorCapability.SEARCH_USERS);
            found = authenticator.searchUsers(keyword, max);
        } else if ("group".equalsIgnoreCase(type)) {
            requireCapability(authenticator, AuthenticatorCapability.SEARCH_GROUPS);
            found = authenticator.searchGroups(keyword, max);
        } else {
            throw new AppException(ErrorCode.INVALID_REQUEST);
        }
        return found.size() > max ? found.subList(0, max) : found;
    }

    private static void requireCapability(Authenticator authenticator, AuthenticatorCapability capability) {
        if (!authenticator.supports(capability)) {
            log.info("Authenticator {} does not support {}", authenticator.getName(), capability);
            throw new AppException(ErrorCode.NOT_SUPPORTED);
        }
    }

    private static AuthenticatorResponse toResponse(Authenticator a) {
        return AuthenticatorResponse.builder()
                .name(a.getName())
                .type(a.getType())
                .canSearchUsers(a.supports(AuthenticatorCapability.SEARCH_USERS))
                .canSearchGroups(a.supports(AuthenticatorCapability.SEARCH_GROUPS))
                .needsPassword(a.supports(AuthenticatorCapability.NEEDS_PASSWORD))
                .canCreateUsers(a.supports(AuthenticatorCapability.CREATE_USERS))
                .isExternal(a.supports(AuthenticatorCapability.EXTERNAL_SOURCE))
                .build();
    }
}
