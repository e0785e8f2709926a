package com.uptimesentinel.service.notify.destination;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class DestinationUrls {
    static final String DISABLE_TLS = "disabletls";

    private DestinationUrls() {
    }

    static Map<String, String> query(URI uri) {
        Map<String, String> query = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            if (entry.isEmpty()) {
                continue;
            }
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    static String webScheme(Map<String, String> query) {
        String flag = query.getOrDefault(DISABLE_TLS, "").toLowerCase(Locale.ROOT);
        return flag.equals("yes") || flag.equals("true") || flag.equals("1") ? "http" : "https";
    }

    static List<String> pathSegments(URI uri) {
        List<String> segments = new ArrayList<>();
        String path = uri.getPath();
        if (path == null) {
            return segments;
        }
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Host part of the authority. Falls back to the raw authority for names {@link URI} does not
     * accept as host names, such as tokens containing underscores.
     */
    static String host(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        return at >= 0 ? authority.substring(at + 1) : authority;
    }

    static String userInfo(URI uri) {
        if (uri.getUserInfo() != null) {
            return uri.getUserInfo();
        }
        String authority = uri.getAuthority();
        if (authority == null) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        return at >= 0 ? authority.substring(0, at) : null;
    }

    static URI under(URI base, String relativePath) {
        String prefix = base.toString();
        return URI.create(prefix.endsWith("/") ? prefix + relativePath : prefix + "/" + relativePath);
    }

    static String requireHost(URI uri, String service) {
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new InvalidDestinationException(service + " destination requires a host");
        }
        return host;
    }

    static String hostAndPort(URI uri, String service) {
        String host = requireHost(uri, service);
        if (host.contains(":") && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return uri.getPort() > 0 ? host + ":" + uri.getPort() : host;
    }

    static String form(Map<String, String> fields) {
        StringBuilder encoded = new StringBuilder();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (encoded.length() > 0) {
                encoded.append('&');
            }
            encoded.append(URLEncoder.encode(field.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(field.getValue(), StandardCharsets.UTF_8));
        }
        return encoded.toString();
    }

    static String pathEncode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) {
            return values;
        }
        for (String value : raw.split(",")) {
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }
}
