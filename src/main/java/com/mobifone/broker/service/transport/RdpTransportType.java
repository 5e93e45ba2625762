package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.enumeration.TransportProtocol;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class RdpTransportType extends AbstractTransportType {
    private static final Set<TransportCapability> CAPABILITIES =
            EnumSet.of(TransportCapability.DIRECT_CONNECTION, TransportCapability.SCRIPT);

    @Override
    public TransportProtocol getProtocol() {
        return TransportProtocol.RDP;
    }

    @Override
    public Set<TransportCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public int getDefaultPort() {
        return 3389;
    }

    @Override
    protected void addProtocolParameters(Map<String, String> params, Transport transport) {
        params.put("domain", param(transport, "domain", ""));
        params.put("width", param(transport, "width", "1920"));
        params.put("height", param(transport, "height", "1080"));
        params.put("bpp", param(transport, "bpp", "32"));
        params.put("redirectDrives", param(transport, "redirectDrives", "1"));
        params.put("redirectPrinters", param(transport, "redirectPrinters", "1"));
    }
}
