package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.enumeration.TransportProtocol;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class VncTransportType extends AbstractTransportType {
    private static final Set<TransportCapability> CAPABILITIES =
            EnumSet.of(TransportCapability.DIRECT_CONNECTION, TransportCapability.SCRIPT);

    @Override
    public TransportProtocol getProtocol() {
        return TransportProtocol.VNC;
    }

    @Override
    public Set<TransportCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public int getDefaultPort() {
        return 5900;
    }

    @Override
    protected void addProtocolParameters(Map<String, String> params, Transport transport) {
        params.put("viewOnly", param(transport, "viewOnly", "0"));
        params.put("fullScreen", param(transport, "fullScreen", "1"));
    }
}
