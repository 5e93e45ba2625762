package com.mobifone.broker.service.transport;

import com.mobifone.broker.configuration.BrokerProperties;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads OS specific script templates from the classpath ({@code <location>/<template>.<os>.txt})
 * and signs the scripts built from them so the client launcher can check they came from this
 * broker.
 */
@Slf4j
@Component
public class ScriptTemplateLoader {
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String location;
    private final byte[] signingKey;
    private final Map<String, Optional<String>> cache = new ConcurrentHashMap<>();

    @Autowired
    public ScriptTemplateLoader(BrokerProperties properties) {
        this(properties.getScripts().getLocation(), properties.getScripts().getSigningKey());
    }

    public ScriptTemplateLoader(String location, String signingKey) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new IllegalStateException("broker.scripts.signing-key is required");
        }
        this.location = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
    }

    /** @throws AppException UNSUPPORTED_OS when the template has no variant for {@code os} */
    public String load(String templateName, ClientOs os) {
        String path = location + "/" + templateName + "." + os.templateName() + ".txt";
        return cache.computeIfAbsent(path, this::read)
                .orElseThrow(() -> {
                    log.warn("No script template {} for client os {}", templateName, os);
                    return new AppException(ErrorCode.UNSUPPORTED_OS);
                });
    }

    private Optional<String> read(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read script template " + path, e);
        }
    }

    /** Base64 HMAC-SHA256 of {@code text} under the broker's signing key. */
    public String sign(String text) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(text.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign script", e);
        }
    }
}
