package com.mobifone.broker.entity.enumeration;

import java.util.Locale;

public enum ClientOs {
    WINDOWS,
    LINUX,
    MACOS,
    ANDROID,
    IOS,
    UNKNOWN;

    /** Lower-case name used in script template file names. */
    public String templateName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClientOs fromUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) return UNKNOWN;
        String ua = userAgent.toLowerCase(Locale.ROOT);
        // Android agents also announce Linux, iOS agents also announce Mac OS X
        if (ua.contains("android")) return ANDROID;
        if (ua.contains("iphone") || ua.contains("ipad")) return IOS;
        if (ua.contains("windows")) return WINDOWS;
        if (ua.contains("mac os x") || ua.contains("macintosh")) return MACOS;
        if (ua.contains("linux")) return LINUX;
        return UNKNOWN;
    }
}
