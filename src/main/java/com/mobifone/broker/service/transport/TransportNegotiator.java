package com.mobifone.broker.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.configuration.BrokerProperties;
import com.mobifone.broker.dto.response.ConnectionInfo;
import com.mobifone.broker.dto.response.ScriptArtifact;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.service.assignment.ResolvedService;
import com.mobifone.broker.service.crypto.CredentialCipher;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.PropertyPlaceholderHelper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Decides whether a transport can reach a machine and builds what the client needs to
 * connect: a direct {@link ConnectionInfo} or a signed launcher {@link ScriptArtifact}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class TransportNegotiator {
    static final PropertyPlaceholderHelper PLACEHOLDERS = new PropertyPlaceholderHelper("${", "}", null, true);

    ReadinessCache readinessCache;
    ReadinessProbe readinessProbe;
    TransportTypeRegistry transportTypeRegistry;
    ScriptTemplateLoader scriptTemplateLoader;
    CredentialCipher credentialCipher;
    ObjectMapper objectMapper;
    BrokerProperties brokerProperties;

    public TransportType typeOf(Transport transport) {
        return transportTypeRegistry.get(transport.getProtocol());
    }

    /**
     * Cached readiness of the transport's listen port on {@code address}. A miss probes once
     * and caches the outcome, negative or not, for the cache TTL.
     */
    public boolean isAvailable(Transport transport, String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        int port = typeOf(transport).listenPort(transport);
        String key = address + ":" + port;
        Optional<Boolean> cached = readinessCache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        boolean ready = readinessProbe.probe(address, port, brokerProperties.getReadiness().getProbeTimeout());
        readinessCache.put(key, ready);
        log.debug("Transport {} on {} ready={}", transport.getName(), key, ready);
        return ready;
    }

    public ConnectionInfo getConnectionInfo(ResolvedService resolved, User user, String password) {
        TransportType type = resolved.getTransportType();
        if (!type.supports(TransportCapability.DIRECT_CONNECTION)) {
            return ConnectionInfo.builder()
                    .protocol(type.getProtocol().name().toLowerCase())
                    .ip(resolved.getAddress())
                    .build();
        }
        return type.getConnectionInfo(resolved.getTransport(), resolved.getAddress(), user, password);
    }

    /**
     * Launcher script for the resolved machine. Non-secret parameters are substituted into the
     * script, which is then signed; the password is only carried sealed inside {@code params}.
     */
    public ScriptArtifact buildConnection(ResolvedService resolved, ClientOs os, User user, String password, String scrambler) {
        TransportType type = resolved.getTransportType();
        if (!type.supports(TransportCapability.SCRIPT)) {
            throw new AppException(ErrorCode.NOT_SUPPORTED);
        }
        Transport transport = resolved.getTransport();
        Map<String, String> params = type.scriptParameters(transport, resolved.getAddress(), user, password, os);
        return buildScript(type.templateName(transport), os, params, type.secretParameters(), scrambler);
    }

    public ScriptArtifact buildScript(String templateName, ClientOs os, Map<String, String> params,
                                      Set<String> secretKeys, String scrambler) {
        String template = scriptTemplateLoader.load(templateName, os);

        Properties visible = new Properties();
        params.forEach((key, value) -> {
            if (!secretKeys.contains(key) && value != null) {
                visible.setProperty(key, value);
            }
        });
        // the signature covers the script as delivered, placeholders filled
        String script = PLACEHOLDERS.replacePlaceholders(template, visible);

        String sealed;
        try {
            sealed = credentialCipher.encrypt(objectMapper.writeValueAsString(params), scrambler);
        } catch (JsonProcessingException e) {
            throw new AppException(ErrorCode.UNCATEGORIZED_EXCEPTION, e);
        }
        return ScriptArtifact.builder()
                .script(Base64.getEncoder().encodeToString(script.getBytes(StandardCharsets.UTF_8)))
                .signature(scriptTemplateLoader.sign(script))
                .params(sealed)
                .build();
    }
}
