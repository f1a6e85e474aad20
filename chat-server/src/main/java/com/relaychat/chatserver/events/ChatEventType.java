package com.relaychat.chatserver.events;

public enum ChatEventType {
    CONNECT,
    DISCONNECT,
    REJECT,
    THROTTLE,
    PROTOCOL_ERROR,
    VALIDATION_ERROR,
    NETWORK_ERROR,
    USERNAME_CHANGE,
    MESSAGE
}
