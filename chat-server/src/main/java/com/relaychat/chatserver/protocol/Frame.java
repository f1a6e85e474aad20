package com.relaychat.chatserver.protocol;

import java.util.Objects;

/**
 * One protocol unit, {@code TYPE|PAYLOAD}. The payload never contains a line break.
 */
public record Frame(FrameType type, String payload) {

    public Frame {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? "" : payload;
    }

    public static Frame chat(String payload) {
        return new Frame(FrameType.CHAT, payload);
    }

    public static Frame server(String payload) {
        return new Frame(FrameType.SERVER, payload);
    }

    public static Frame userList(String payload) {
        return new Frame(FrameType.USER_LIST, payload);
    }
}
