package com.mobifone.broker.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstanceResponse {
    String id;
    String serviceId;
    String userId;
    String address;
    String state;
    String backendRef;
    Instant assignedAt;
    String srcIp;
    String srcHostname;
}
