package com.trackerrelay.collectors.probe;

import com.trackerrelay.core.model.TrackerScheme;

import java.util.Optional;

public record UdpTarget(String host, int port) {
    public static Optional<UdpTarget> parse(String endpoint) {
        if (endpoint == null || !endpoint.startsWith(TrackerScheme.UDP.prefix())) {
            return Optional.empty();
        }
        String authority = endpoint.substring(TrackerScheme.UDP.prefix().length());
        int slash = authority.indexOf('/');
        if (slash >= 0) {
            authority = authority.substring(0, slash);
        }
        String[] parts = authority.split(":", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < parts[1].length(); i++) {
            if (!Character.isDigit(parts[1].charAt(i))) {
                return Optional.empty();
            }
        }
        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (port < 1 || port > 65535) {
            return Optional.empty();
        }
        return Optional.of(new UdpTarget(parts[0], port));
    }
}
