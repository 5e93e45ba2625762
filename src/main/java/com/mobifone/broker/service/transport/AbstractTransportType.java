package com.mobifone.broker.service.transport;

import com.mobifone.broker.dto.response.ConnectionInfo;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public abstract class AbstractTransportType implements TransportType {

    @Override
    public String getDefaultTemplate() {
        return getProtocol().name().toLowerCase() + "/connect";
    }

    @Override
    public ConnectionInfo getConnectionInfo(Transport transport, String address, User user, String password) {
        return ConnectionInfo.builder()
                .username(username(transport, user))
                .password(password == null ? "" : password)
                .domain(param(transport, "domain", ""))
                .protocol(getProtocol().name().toLowerCase())
                .ip(address)
                .port(listenPort(transport))
                .build();
    }

    @Override
    public Map<String, String> scriptParameters(Transport transport, String address, User user, String password, ClientOs os) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("address", address);
        params.put("port", String.valueOf(listenPort(transport)));
        params.put("username", username(transport, user));
        params.put("password", password == null ? "" : password);
        params.put("os", os.templateName());
        addProtocolParameters(params, transport);
        return params;
    }

    /** Protocol specific extras with their defaults; the transport row may override any of them. */
    protected abstract void addProtocolParameters(Map<String, String> params, Transport transport);

    protected String username(Transport transport, User user) {
        return param(transport, "username", user == null ? "" : user.getUsername());
    }

    protected static String param(Transport transport, String key, String fallback) {
        return Optional.ofNullable(transport.getParams())
                .map(p -> p.get(key))
                .filter(v -> !v.isBlank())
                .orElse(fallback);
    }
}
