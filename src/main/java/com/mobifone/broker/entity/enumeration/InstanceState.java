package com.mobifone.broker.entity.enumeration;

import java.util.EnumSet;
import java.util.Set;

public enum InstanceState {
    PROVISIONING,
    READY,
    ERROR,
    REMOVING;

    /** States in which an instance still counts against its user and pool. */
    public static final Set<InstanceState> ACTIVE = EnumSet.of(PROVISIONING, READY, ERROR);
}
