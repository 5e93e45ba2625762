package com.mobifone.broker.service.transport;

import java.time.Duration;

/** Reachability check against a candidate machine's transport listen port. */
public interface ReadinessProbe {
    boolean probe(String address, int port, Duration timeout);
}
