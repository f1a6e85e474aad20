package com.relaychat.chatserver.server;

/**
 * Fatal server-level failure, such as being unable to bind the listening socket.
 */
public class ChatServerException extends RuntimeException {

    public ChatServerException(String message) {
        super(message);
    }

    public ChatServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
