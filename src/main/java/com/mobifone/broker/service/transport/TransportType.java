package com.mobifone.broker.service.transport;

import com.mobifone.broker.dto.response.ConnectionInfo;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.entity.enumeration.TransportProtocol;

import java.util.Map;
import java.util.Set;

/**
 * Protocol specific behaviour of a transport. Implementations are stateless beans; the
 * per-row configuration comes in through the {@link Transport} entity.
 */
public interface TransportType {
    TransportProtocol getProtocol();

    Set<TransportCapability> getCapabilities();

    int getDefaultPort();

    /** Template used when the transport row does not name one. */
    String getDefaultTemplate();

    default boolean supports(TransportCapability capability) {
        return getCapabilities().contains(capability);
    }

    default int listenPort(Transport transport) {
        return transport.getListenPort() != null ? transport.getListenPort() : getDefaultPort();
    }

    default String templateName(Transport transport) {
        String template = transport.getScriptTemplate();
        return template == null || template.isBlank() ? getDefaultTemplate() : template;
    }

    ConnectionInfo getConnectionInfo(Transport transport, String address, User user, String password);

    /**
     * Every value the launcher script needs, the password included. Keys listed by
     * {@link #secretParameters()} are kept out of the script text.
     */
    Map<String, String> scriptParameters(Transport transport, String address, User user, String password, ClientOs os);

    default Set<String> secretParameters() {
        return Set.of("password");
    }
}
