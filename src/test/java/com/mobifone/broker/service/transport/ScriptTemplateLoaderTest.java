package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptTemplateLoaderTest {
    private final ScriptTemplateLoader loader = new ScriptTemplateLoader("transport-scripts/", "test-signing-key");

    @Test
    void templateKeepsPlaceholders() {
        assertTrue(loader.load("rdp/connect", ClientOs.WINDOWS).contains("${address}"));
    }

    @Test
    void signatureIsHmacSha256OfText() throws Exception {
        String text = "full address:s:10.0.0.5:3389";

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("test-signing-key".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = Base64.getEncoder().encodeToString(mac.doFinal(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals(expected, loader.sign(text));
    }

    @Test
    void templatesAreLoadedOnce() {
        assertSame(loader.load("vnc/connect", ClientOs.LINUX), loader.load("vnc/connect", ClientOs.LINUX));
    }

    @Test
    void otherKeyGivesOtherSignature() {
        ScriptTemplateLoader other = new ScriptTemplateLoader("transport-scripts", "another-key");

        String script = loader.load("rdp/connect", ClientOs.MACOS);

        assertNotEquals(loader.sign(script), other.sign(script));
    }

    @Test
    void missingOsVariantIsUnsupported() {
        AppException e = assertThrows(AppException.class, () -> loader.load("nx/connect", ClientOs.MACOS));
        assertEquals(ErrorCode.UNSUPPORTED_OS, e.getErrorCode());
        assertEquals(ErrorCode.UNSUPPORTED_OS,
                assertThrows(AppException.class, () -> loader.load("rdp/connect", ClientOs.ANDROID)).getErrorCode());
    }

    @Test
    void signingKeyIsRequired() {
        assertThrows(IllegalStateException.class, () -> new ScriptTemplateLoader("transport-scripts", " "));
    }
}
