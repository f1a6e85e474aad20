package com.relaychat.chatserver.web.dto;

import com.relaychat.chatserver.session.ClientSession;

public record OnlineUserDto(long sessionId, String user, String address, String state,
                            long connectedAtSeconds, long messages) {
    public static OnlineUserDto fromSession(ClientSession session) {
        return new OnlineUserDto(
                session.id(),
                session.displayName(),
                session.address(),
                session.state().name(),
                session.connectedAt().getEpochSecond(),
                session.messageCount()
        );
    }
}
