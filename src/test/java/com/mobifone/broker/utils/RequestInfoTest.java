package com.mobifone.broker.utils;

import com.mobifone.broker.entity.enumeration.ClientOs;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RequestInfoTest {

    @Test
    void forwardedForWinsOverRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.1.1.1");
        request.addHeader("X-Forwarded-For", "192.0.2.10, 10.1.1.1");

        assertEquals("192.0.2.10", RequestInfo.clientIp(request));
    }

    @Test
    void remoteAddressIsFallback() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.1.1.1");
        request.addHeader("X-Forwarded-For", "unknown");

        assertEquals("10.1.1.1", RequestInfo.clientIp(request));
    }

    @Test
    void osIsTakenFromUserAgent() {
        assertEquals(ClientOs.WINDOWS, osFor("Mozilla/5.0 (Windows NT 10.0; Win64; x64)"));
        assertEquals(ClientOs.ANDROID, osFor("Mozilla/5.0 (Linux; Android 14; Pixel 8)"));
        assertEquals(ClientOs.IOS, osFor("Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X)"));
        assertEquals(ClientOs.MACOS, osFor("Mozilla/5.0 (Macintosh; Intel Mac OS X 14_1)"));
        assertEquals(ClientOs.LINUX, osFor("UDSClient/4.0 (X11; Linux x86_64)"));
        assertEquals(ClientOs.UNKNOWN, osFor(null));
    }

    private static ClientOs osFor(String userAgent) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        if (userAgent != null) {
            request.addHeader(HttpHeaders.USER_AGENT, userAgent);
        }
        return RequestInfo.clientOs(request);
    }
}
