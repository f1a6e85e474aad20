package com.relaychat.chatserver.protocol;

import java.io.IOException;

/**
 * A peer violated the framing rules. The connection cannot continue.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
