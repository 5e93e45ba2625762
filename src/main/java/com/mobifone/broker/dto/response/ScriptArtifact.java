package com.mobifone.broker.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Script delivered to the client. {@code script} is Base64 of the template with non-secret
 * values filled in, {@code params} is Base64 of the parameter JSON sealed with the client's
 * scrambler; the password only ever travels inside {@code params}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ScriptArtifact {
    String script;
    String signature;
    String params;
}
