package com.mobifone.broker.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AuthenticationRequest {
    @Builder.Default
    String authenticator = "internal";

    @NotBlank
    String username;

    @NotBlank
    String password;

    @Override
    public String toString() {
        return "AuthenticationRequest(authenticator=" + authenticator + ", username=" + username + ")";
    }
}
