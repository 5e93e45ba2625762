package com.mobifone.broker.service.transport;

public enum TransportCapability {
    /** Hands the client host, port and credentials so it can open the connection itself. */
    DIRECT_CONNECTION,
    /** Produces a signed, OS-specific launcher script. */
    SCRIPT
}
