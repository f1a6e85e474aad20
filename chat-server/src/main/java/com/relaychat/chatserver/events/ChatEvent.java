package com.relaychat.chatserver.events;

import java.time.Instant;

/**
 * Structured event emitted by the chat core. {@code sessionId} is 0 for events that happen
 * before a session exists, such as rejected connections.
 */
public record ChatEvent(ChatEventType type, long sessionId, String address, String detail, Instant timestamp) {

    public static ChatEvent of(ChatEventType type, long sessionId, String address, String detail) {
        return new ChatEvent(type, sessionId, address, detail, Instant.now());
    }
}
