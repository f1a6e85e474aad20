package com.relaychat.chatserver.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Startup parameters of the chat server, bound once from {@code chat.server.*}.
 */
@Validated
@ConfigurationProperties(prefix = "chat.server")
public record ChatServerProperties(
        @NotBlank @DefaultValue("0.0.0.0") String host,
        @Min(0) @Max(65535) @DefaultValue("8080") int port,
        @Min(1) @DefaultValue("100") int maxClients,
        @Min(1) @DefaultValue("5") int maxConnectionsPerIp,
        @Min(0) @DefaultValue("30") int connectionRatePerMinute,
        @NotNull @DefaultValue("5m") Duration blockDuration,
        @Valid @NotNull @DefaultValue RateLimit rateLimit,
        @Min(1) @Max(2000) @DefaultValue("50") int historySize,
        @NotNull @DefaultValue("30m") Duration idleTimeout,
        @NotNull @DefaultValue("15s") Duration idleSweepInterval,
        @NotNull @DefaultValue("10s") Duration writeTimeout,
        @NotNull @DefaultValue("5s") Duration shutdownTimeout,
        @Min(64) @DefaultValue("4096") int maxFrameBytes,
        @Min(1) @DefaultValue("50") int maxUsernameLength,
        @Min(1) @DefaultValue("1000") int maxMessageLength,
        @Min(1) @DefaultValue("256") int outboundQueueSize,
        @Valid @NotNull @DefaultValue Discovery discovery
) {

    /**
     * Token bucket per session: bursts up to {@code capacity}, sustained
     * {@code refillTokens} per {@code refillPeriod}.
     */
    public record RateLimit(
            @Min(1) @DefaultValue("60") int capacity,
            @Min(1) @DefaultValue("60") int refillTokens,
            @NotNull @DefaultValue("1m") Duration refillPeriod
    ) {
    }

    public record Discovery(
            @DefaultValue("true") boolean enabled,
            @Min(1) @Max(65535) @DefaultValue("8081") int port,
            @NotNull @DefaultValue("5s") Duration interval
    ) {
    }
}
