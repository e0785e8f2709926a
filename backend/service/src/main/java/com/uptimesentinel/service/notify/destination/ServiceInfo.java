package com.uptimesentinel.service.notify.destination;

public record ServiceInfo(String name, String scheme, String urlFormat, String example, String description) {
}
