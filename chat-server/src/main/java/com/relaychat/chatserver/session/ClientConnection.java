package com.relaychat.chatserver.session;

import com.relaychat.chatserver.protocol.Frame;

import java.io.IOException;
import java.time.Duration;

/**
 * Outbound side of one client connection.
 */
public interface ClientConnection {

    /**
     * Queues a frame for delivery. Never blocks on the network.
     *
     * @throws IOException if the connection is closed or cannot keep up
     */
    void send(Frame frame) throws IOException;

    /**
     * Flushes what is already queued, then closes. Unblocks the reading side.
     */
    void close();

    /**
     * Closes immediately, discarding anything still queued.
     */
    void abort();

    boolean isOpen();

    /**
     * Whether a write to the peer has been blocked for longer than {@code timeout}.
     */
    default boolean isWriteStalled(Duration timeout) {
        return false;
    }
}
