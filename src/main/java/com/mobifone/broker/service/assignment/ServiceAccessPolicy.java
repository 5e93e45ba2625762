package com.mobifone.broker.service.assignment;

import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.User;

/** Permission provider consulted before a service is resolved for a user. */
public interface ServiceAccessPolicy {
    boolean hasAccess(User user, LogicalService service);
}
