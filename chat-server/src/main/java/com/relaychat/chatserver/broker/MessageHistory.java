package com.relaychat.chatserver.broker;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of messages. Appending to a full buffer overwrites the oldest entry.
 */
public class MessageHistory {
    private final ChatMessage[] ring;
    private int head;
    private int size;

    public MessageHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.ring = new ChatMessage[capacity];
    }

    public synchronized void append(ChatMessage message) {
        ring[(head + size) % ring.length] = message;
        if (size < ring.length) {
            size++;
        } else {
            head = (head + 1) % ring.length;
        }
    }

    /**
     * Returns the retained messages, oldest first.
     */
    public synchronized List<ChatMessage> snapshot() {
        List<ChatMessage> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(ring[(head + i) % ring.length]);
        }
        return copy;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    public synchronized void clear() {
        for (int i = 0; i < ring.length; i++) {
            ring[i] = null;
        }
        head = 0;
        size = 0;
    }
}
