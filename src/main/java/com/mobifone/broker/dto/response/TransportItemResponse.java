package com.mobifone.broker.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TransportItemResponse {
    String id;
    String name;
    String protocol;
    Integer priority;
}
