package com.mobifone.broker.service.provisioning;

import lombok.Value;

@Value
public class InstanceStatus {
    public enum State { PENDING, READY, FAILED }

    State state;
    String address;
    String error;

    public static InstanceStatus pending() {
        return new InstanceStatus(State.PENDING, null, null);
    }

    public static InstanceStatus ready(String address) {
        return new InstanceStatus(State.READY, address, null);
    }

    public static InstanceStatus failed(String error) {
        return new InstanceStatus(State.FAILED, null, error);
    }
}
