package com.relaychat.chatserver.broker;

import com.relaychat.chatserver.protocol.FrameType;

public enum MessageType {
    CHAT(FrameType.CHAT),
    SERVER(FrameType.SERVER),
    USERLIST(FrameType.USER_LIST),
    COMMAND(FrameType.COMMAND);

    private final FrameType frameType;

    MessageType(FrameType frameType) {
        this.frameType = frameType;
    }

    public FrameType frameType() {
        return frameType;
    }
}
