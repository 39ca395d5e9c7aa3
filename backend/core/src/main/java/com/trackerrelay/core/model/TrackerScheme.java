package com.trackerrelay.core.model;

public enum TrackerScheme {
    HTTP("http://"),
    HTTPS("https://"),
    UDP("udp://"),
    OTHER("");

    private final String prefix;

    TrackerScheme(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public boolean isHttp() {
        return this == HTTP || this == HTTPS;
    }

    public static TrackerScheme of(String endpoint) {
        if (endpoint == null) {
            return OTHER;
        }
        if (endpoint.startsWith(UDP.prefix)) {
            return UDP;
        }
        if (endpoint.startsWith(HTTPS.prefix)) {
            return HTTPS;
        }
        if (endpoint.startsWith(HTTP.prefix)) {
            return HTTP;
        }
        return OTHER;
    }
}
