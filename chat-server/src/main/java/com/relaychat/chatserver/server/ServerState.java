package com.relaychat.chatserver.server;

/**
 * {@code INIT -> LISTENING -> SHUTTING_DOWN -> STOPPED}.
 */
public enum ServerState {
    INIT,
    LISTENING,
    SHUTTING_DOWN,
    STOPPED
}
