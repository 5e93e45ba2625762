package com.mobifone.broker.service.auth;

import com.mobifone.broker.dto.response.SearchItemResponse;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.repository.UserGroupRepository;
import com.mobifone.broker.repository.UserRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Users and groups stored in the broker database, passwords as BCrypt hashes. */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class InternalAuthenticator implements Authenticator {
    public static final String NAME = "internal";

    private static final Set<AuthenticatorCapability> CAPABILITIES = EnumSet.of(
            AuthenticatorCapability.SEARCH_USERS,
            AuthenticatorCapability.SEARCH_GROUPS,
            AuthenticatorCapability.CREATE_USERS,
            AuthenticatorCapability.NEEDS_PASSWORD);

    UserRepository userRepository;
    UserGroupRepository userGroupRepository;
    PasswordEncoder passwordEncoder;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getType() {
        return "InternalDBAuth";
    }

    @Override
    public Set<AuthenticatorCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public Optional<User> authenticate(String username, String password) {
        return userRepository.findByUsernameAndAuthenticator(username, NAME)
                .filter(user -> user.getPassword() != null && passwordEncoder.matches(password, user.getPassword()));
    }

    @Override
    public List<SearchItemResponse> searchUsers(String term, int limit) {
        return userRepository.searchInAuthenticator(NAME, term, PageRequest.of(0, limit)).stream()
                .map(u -> SearchItemResponse.builder()
                        .id(u.getUsername())
                        .name(u.getRealName() == null ? u.getUsername() : u.getRealName())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public List<SearchItemResponse> searchGroups(String term, int limit) {
        return userGroupRepository
                .findByAuthenticatorAndNameContainingIgnoreCaseOrderByName(NAME, term, PageRequest.of(0, limit)).stream()
                .map(g -> SearchItemResponse.builder().id(g.getId()).name(g.getName()).build())
                .collect(Collectors.toList());
    }
}
