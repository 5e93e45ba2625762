package com.mobifone.broker.service.assignment;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;

/** Stable codes shown to the client next to the "being prepared" message. */
@Getter
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public enum NotReadyReason {
    PROVISIONING(0x0001),
    TRANSPORT_UNREACHABLE(0x0002);

    int code;
}
