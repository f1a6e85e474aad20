package com.relaychat.chatserver.events;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts chat events by type since startup.
 */
public class ChatStatistics implements ChatEventListener {
    private final Instant startedAt = Instant.now();
    private final Map<ChatEventType, AtomicLong> counters = new EnumMap<>(ChatEventType.class);

    public ChatStatistics() {
        for (ChatEventType type : ChatEventType.values()) {
            counters.put(type, new AtomicLong());
        }
    }

    @Override
    public void onEvent(ChatEvent event) {
        counters.get(event.type()).incrementAndGet();
    }

    public long count(ChatEventType type) {
        return counters.get(type).get();
    }

    public Map<ChatEventType, Long> snapshot() {
        Map<ChatEventType, Long> copy = new EnumMap<>(ChatEventType.class);
        counters.forEach((type, value) -> copy.put(type, value.get()));
        return copy;
    }

    public Instant startedAt() {
        return startedAt;
    }
}
