package com.mobifone.broker.service.connection;

import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** A positional /connection call with the caller's identity and origin. */
@Value
@Builder
public class ConnectionRequest {
    @Singular
    List<String> segments;
    User user;
    ClientOs clientOs;
    String clientIp;
    /** Scrambler-encrypted password, if the client sent one. */
    String password;
    String scrambler;

    public String segment(int index) {
        return segments.get(index);
    }

    @Override
    public String toString() {
        return "ConnectionRequest(segments=" + segments + ", user=" + (user == null ? null : user.getId())
                + ", clientOs=" + clientOs + ", clientIp=" + clientIp + ")";
    }
}
