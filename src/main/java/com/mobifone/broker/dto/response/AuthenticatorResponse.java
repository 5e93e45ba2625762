package com.mobifone.broker.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AuthenticatorResponse {
    String name;
    String type;
    boolean canSearchUsers;
    boolean canSearchGroups;
    boolean needsPassword;
    boolean canCreateUsers;
    @JsonProperty("isExternal")
    boolean isExternal;
}
