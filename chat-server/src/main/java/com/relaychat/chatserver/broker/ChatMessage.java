package com.relaychat.chatserver.broker;

import com.relaychat.chatserver.protocol.Frame;

import java.time.Instant;
import java.util.Objects;

public record ChatMessage(String sender, String content, Instant timestamp, MessageType type) {
    public static final String SERVER_SENDER = "Server";

    public ChatMessage {
        Objects.requireNonNull(type, "type");
        content = content == null ? "" : content;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ChatMessage chat(String sender, String content) {
        return new ChatMessage(sender, content, Instant.now(), MessageType.CHAT);
    }

    public static ChatMessage server(String content) {
        return new ChatMessage(SERVER_SENDER, content, Instant.now(), MessageType.SERVER);
    }

    public static ChatMessage userList(String content) {
        return new ChatMessage(SERVER_SENDER, content, Instant.now(), MessageType.USERLIST);
    }

    /**
     * Chat lines carry their sender on the wire as {@code MSG|sender: text}; all other
     * types carry the content alone.
     */
    public Frame toFrame() {
        if (type == MessageType.CHAT) {
            return new Frame(type.frameType(), sender + ": " + content);
        }
        return new Frame(type.frameType(), content);
    }
}
