package com.phantomrelay.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Relay settings, bound from {@code relay.*}.
 *
 * @param path            WebSocket endpoint path
 * @param retention       how long an undelivered message is kept
 * @param cleanupInterval time between two eviction sweeps
 * @param lockStripes     number of per-account lock stripes
 */
@ConfigurationProperties("relay")
public record RelayProperties(
        @DefaultValue("/") String path,
        @DefaultValue("7d") Duration retention,
        @DefaultValue("1h") Duration cleanupInterval,
        @DefaultValue("64") int lockStripes
) {

    public static RelayProperties defaults() {
        return new RelayProperties("/", Duration.ofDays(7), Duration.ofHours(1), 64);
    }
}
