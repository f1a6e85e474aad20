package com.relaychat.chatserver.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes chat events to the {@code chat.events} logger.
 */
public class LoggingChatEventListener implements ChatEventListener {
    private static final Logger log = LoggerFactory.getLogger("chat.events");

    @Override
    public void onEvent(ChatEvent event) {
        switch (event.type()) {
            case REJECT, THROTTLE, PROTOCOL_ERROR, NETWORK_ERROR ->
                    log.warn("{} session={} addr={} {}", event.type(), event.sessionId(), event.address(), event.detail());
            case MESSAGE ->
                    log.debug("{} session={} addr={} {}", event.type(), event.sessionId(), event.address(), event.detail());
            default ->
                    log.info("{} session={} addr={} {}", event.type(), event.sessionId(), event.address(), event.detail());
        }
    }
}
