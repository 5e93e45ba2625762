package com.mobifone.broker.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

/** Parameters a native client needs to open the connection itself. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ConnectionInfo {
    @Builder.Default
    String username = "";
    @Builder.Default
    String password = "";
    @Builder.Default
    String domain = "";
    @Builder.Default
    String protocol = "unknown";
    String ip;
    Integer port;

    @Override
    public String toString() {
        return "ConnectionInfo(username=" + username + ", domain=" + domain + ", protocol=" + protocol
                + ", ip=" + ip + ", port=" + port + ")";
    }
}
