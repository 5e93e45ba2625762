package com.mobifone.broker.service.assignment;

import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.UserGroup;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/** A user may use an enabled service when they share at least one group with it. */
@Component
public class GroupServiceAccessPolicy implements ServiceAccessPolicy {

    @Override
    public boolean hasAccess(User user, LogicalService service) {
        if (user == null || service == null || !Boolean.TRUE.equals(service.getEnabled())) {
            return false;
        }
        Set<String> userGroups = user.getGroups().stream()
                .map(UserGroup::getId)
                .collect(Collectors.toSet());
        return service.getGroups().stream()
                .map(UserGroup::getId)
                .anyMatch(userGroups::contains);
    }
}
