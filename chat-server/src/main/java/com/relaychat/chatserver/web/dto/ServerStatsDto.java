package com.relaychat.chatserver.web.dto;

import java.util.Map;

/**
 * Counters since startup. {@code events} is keyed by event type name.
 */
public record ServerStatsDto(String state,
                             int activeSessions,
                             long admittedConnections,
                             long rejectedConnections,
                             long broadcasts,
                             long deliveryFailures,
                             int historySize,
                             long uptimeSeconds,
                             Map<String, Long> events) {
}
