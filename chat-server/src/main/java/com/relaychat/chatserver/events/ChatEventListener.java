package com.relaychat.chatserver.events;

/**
 * Sink for events emitted by the chat core. Implementations must be thread-safe and should
 * return quickly; they are called from connection workers.
 */
@FunctionalInterface
public interface ChatEventListener {

    ChatEventListener NO_OP = event -> { };

    void onEvent(ChatEvent event);
}
