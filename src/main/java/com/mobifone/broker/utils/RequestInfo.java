package com.mobifone.broker.utils;

import com.mobifone.broker.entity.enumeration.ClientOs;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

public final class RequestInfo {
    private RequestInfo() {
    }

    public static String clientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (isUnknown(ip)) {
            ip = request.getHeader("Proxy-Client-IP");
        }
        if (isUnknown(ip)) {
            ip = request.getHeader("WL-Proxy-Client-IP");
        }
        if (isUnknown(ip)) {
            ip = request.getRemoteAddr();
        }
        // X-Forwarded-For may hold a proxy chain, the first hop is the client
        int comma = ip == null ? -1 : ip.indexOf(',');
        return comma > 0 ? ip.substring(0, comma).trim() : ip;
    }

    public static ClientOs clientOs(HttpServletRequest request) {
        return ClientOs.fromUserAgent(request.getHeader(HttpHeaders.USER_AGENT));
    }

    private static boolean isUnknown(String ip) {
        return ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip);
    }
}
