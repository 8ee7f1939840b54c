package com.mike.reportpopulator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "reportpopulator.mail")
public record ImapProperties(
        String protocol,
        String host,
        Integer port,
        String username,
        String password,
        String folder,
        Duration connectionTimeout,
        Duration timeout
) {
    public ImapProperties {
        if (protocol == null || protocol.isBlank()) protocol = "imaps";
        if (folder == null || folder.isBlank()) folder = "INBOX";
        if (connectionTimeout == null) connectionTimeout = Duration.ofSeconds(10);
        if (timeout == null) timeout = Duration.ofSeconds(30);
    }
}
