package com.uptimesentinel.probes.tcp;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Host and port parsed from either {@code tcp://host:port} or a bare {@code host:port}.
 * IPv6 literals must be bracketed.
 */
record TcpAddress(String host, int port) {
    static TcpAddress parse(String target) {
        String raw = target == null ? "" : target.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("no host:port specified");
        }
        if (raw.contains("://")) {
            return fromUri(raw);
        }
        return fromHostPort(raw, raw);
    }

    private static TcpAddress fromUri(String raw) {
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid TCP URL: " + e.getMessage(), e);
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw new IllegalArgumentException("no host:port specified");
        }
        return fromHostPort(authority, raw);
    }

    private static TcpAddress fromHostPort(String hostPort, String original) {
        String host;
        String portText;
        if (hostPort.startsWith("[")) {
            int close = hostPort.indexOf(']');
            if (close < 0 || close + 1 >= hostPort.length() || hostPort.charAt(close + 1) != ':') {
                throw requiresPort(original);
            }
            host = hostPort.substring(1, close);
            portText = hostPort.substring(close + 2);
        } else {
            int colon = hostPort.lastIndexOf(':');
            if (colon < 0 || hostPort.indexOf(':') != colon) {
                throw requiresPort(original);
            }
            host = hostPort.substring(0, colon);
            portText = hostPort.substring(colon + 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("no host specified in " + original);
        }
        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port '" + portText + "' in " + original, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range in " + original);
        }
        return new TcpAddress(host, port);
    }

    private static IllegalArgumentException requiresPort(String original) {
        return new IllegalArgumentException("TCP check requires host:port format, got: " + original);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
