package com.relaychat.chatserver.session;

/**
 * Per-connection lifecycle: {@code ADMITTED -> AUTHENTICATING -> ACTIVE -> CLOSING}.
 */
public enum SessionState {
    ADMITTED,
    AUTHENTICATING,
    ACTIVE,
    CLOSING
}
