package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.enumeration.TransportProtocol;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** NX sessions are tunnelled over SSH, hence the default port. */
@Component
public class NxTransportType extends AbstractTransportType {
    private static final Set<TransportCapability> CAPABILITIES =
            EnumSet.of(TransportCapability.DIRECT_CONNECTION, TransportCapability.SCRIPT);

    @Override
    public TransportProtocol getProtocol() {
        return TransportProtocol.NX;
    }

    @Override
    public Set<TransportCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public int getDefaultPort() {
        return 22;
    }

    @Override
    protected void addProtocolParameters(Map<String, String> params, Transport transport) {
        params.put("session", param(transport, "session", "gnome"));
        params.put("connection", param(transport, "connection", "wan"));
        params.put("cacheDisk", param(transport, "cacheDisk", "32M"));
        params.put("cacheMem", param(transport, "cacheMem", "8M"));
    }
}
