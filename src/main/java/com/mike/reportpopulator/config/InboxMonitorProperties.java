package com.mike.reportpopulator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reportpopulator.monitor")
public record InboxMonitorProperties(
        boolean enabled,
        int filterDays
) {
}
