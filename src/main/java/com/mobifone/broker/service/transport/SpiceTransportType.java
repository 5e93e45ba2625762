package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.enumeration.TransportProtocol;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** SPICE is only reachable through a remote-viewer file, there is no direct mode. */
@Component
public class SpiceTransportType extends AbstractTransportType {
    private static final Set<TransportCapability> CAPABILITIES = EnumSet.of(TransportCapability.SCRIPT);

    @Override
    public TransportProtocol getProtocol() {
        return TransportProtocol.SPICE;
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
        params.put("fullScreen", param(transport, "fullScreen", "1"));
        params.put("usbRedirect", param(transport, "usbRedirect", "0"));
    }
}
