package com.relaychat.chatserver.protocol;

public class FrameTooLongException extends ProtocolException {
    private final int limit;

    public FrameTooLongException(int limit) {
        super("Frame exceeds " + limit + " bytes");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
