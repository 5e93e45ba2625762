package com.mobifone.broker.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ServiceItemResponse {
    String id;
    String name;
    String comments;
    boolean inUse;
    List<TransportItemResponse> transports;
}
