package com.github.stormino.medialib.service.egress;

import java.util.Locale;

public enum RouteScheme {
    DIRECT(null, 0),
    HTTP("http", 8080),
    HTTPS("https", 443),
    SOCKS5("socks5", 1080);

    private final String protocol;
    private final int defaultPort;

    RouteScheme(String protocol, int defaultPort) {
        this.protocol = protocol;
        this.defaultPort = defaultPort;
    }

    public String getProtocol() {
        return protocol;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public static RouteScheme parse(String value) {
        if (value == null || value.isBlank()) {
            return DIRECT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "direct":
            case "none":
                return DIRECT;
            case "http":
                return HTTP;
            case "https":
                return HTTPS;
            case "socks5":
            case "socks5h":
            case "socks":
                return SOCKS5;
            default:
                throw new IllegalArgumentException("Unknown route scheme: " + value);
        }
    }
}
