package com.mobifone.broker.service.provisioning;

import lombok.Value;

/** Reference of a machine requested from a backend; no address yet means it is still pending. */
@Value
public class AcquireResult {
    String reference;
    String address;

    public static AcquireResult pending(String reference) {
        return new AcquireResult(reference, null);
    }

    public static AcquireResult ready(String reference, String address) {
        return new AcquireResult(reference, address);
    }

    public boolean isPending() {
        return address == null || address.isBlank();
    }
}
