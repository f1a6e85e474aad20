package com.relaychat.chatserver.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans an event out to several listeners. A failing listener is logged and skipped.
 */
public class CompositeChatEventListener implements ChatEventListener {
    private static final Logger log = LoggerFactory.getLogger(CompositeChatEventListener.class);

    private final List<ChatEventListener> delegates;

    public CompositeChatEventListener(List<? extends ChatEventListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onEvent(ChatEvent event) {
        for (ChatEventListener delegate : delegates) {
            try {
                delegate.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener {} failed on {}", delegate.getClass().getSimpleName(), event.type(), e);
            }
        }
    }
}
