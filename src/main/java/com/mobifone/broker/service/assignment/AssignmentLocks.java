package com.mobifone.broker.service.assignment;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutual exclusion per (user, service). Two resolves for the same pair always map
 * to the same stripe, so only one of them can create or claim an assignment at a time.
 * <p>
 * A second, independent set of stripes guards the capacity check of a service. It is only
 * ever taken while a pair lock is held, never the other way round.
 */
@Component
public class AssignmentLocks {
    private static final int STRIPES = 64;

    private final ReentrantLock[] pairLocks = newStripes();
    private final ReentrantLock[] capacityLocks = newStripes();

    public <T> T withLock(String key, Supplier<T> action) {
        return locked(pairLocks, key, action);
    }

    /** Serializes count-then-provision for one service on this node. */
    public <T> T withCapacityLock(String serviceId, Supplier<T> action) {
        return locked(capacityLocks, serviceId, action);
    }

    private static <T> T locked(ReentrantLock[] stripes, String key, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
