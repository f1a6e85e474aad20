package com.relaychat.chatserver.broker;

import com.relaychat.chatserver.events.ChatEvent;
import com.relaychat.chatserver.events.ChatEventListener;
import com.relaychat.chatserver.events.ChatEventType;
import com.relaychat.chatserver.protocol.Frame;
import com.relaychat.chatserver.session.ClientRegistry;
import com.relaychat.chatserver.session.ClientSession;
import com.relaychat.chatserver.session.RosterEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Fans messages out to every session in the {@link ClientRegistry} and keeps the chat history.
 * <p>
 * All broadcasts go through one lock, so every connected session observes them in the same
 * relative order. A recipient whose write fails is aborted; its worker tears it down, and the
 * broadcast carries on with the remaining recipients.
 */
public class MessageBroker {
    private static final Logger log = LoggerFactory.getLogger(MessageBroker.class);

    private final ClientRegistry registry;
    private final MessageHistory history;
    private final ChatEventListener events;
    private final ReentrantLock broadcastLock = new ReentrantLock();

    private final AtomicLong broadcasts = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();

    public MessageBroker(ClientRegistry registry, int historyCapacity, ChatEventListener events) {
        this.registry = registry;
        this.history = new MessageHistory(historyCapacity);
        this.events = events == null ? ChatEventListener.NO_OP : events;
    }

    /**
     * Delivers a message to every joined session except {@code exclude} (may be {@code null}).
     */
    public DeliveryReport broadcast(ChatMessage message, ClientSession exclude) {
        Frame frame = message.toFrame();
        broadcastLock.lock();
        try {
            return deliverToAll(frame, exclude);
        } finally {
            broadcastLock.unlock();
        }
    }

    public DeliveryReport broadcast(ChatMessage message) {
        return broadcast(message, null);
    }

    /**
     * Records a chat message in history and broadcasts it to everyone, as one step.
     */
    public DeliveryReport publish(ChatMessage message) {
        Frame frame = message.toFrame();
        broadcastLock.lock();
        try {
            historyAppend(message);
            return deliverToAll(frame, null);
        } finally {
            broadcastLock.unlock();
        }
    }

    public DeliveryReport broadcastNotice(String text, ClientSession exclude) {
        return broadcast(ChatMessage.server(text), exclude);
    }

    public DeliveryReport broadcastRoster() {
        return broadcast(ChatMessage.userList(encodeRoster(registry.snapshotUsers())));
    }

    public boolean sendDirect(long sessionId, ChatMessage message) {
        Optional<ClientSession> session = registry.find(sessionId);
        return session.isPresent() && deliver(session.get(), message.toFrame());
    }

    public boolean sendDirect(ClientSession session, ChatMessage message) {
        return deliver(session, message.toFrame());
    }

    /**
     * Sends the welcome notice and the full history to a newly admitted session, then marks it
     * joined. Runs under the broadcast lock so the newcomer neither misses nor duplicates a
     * concurrent broadcast.
     */
    public boolean welcome(ClientSession session, String greeting) {
        broadcastLock.lock();
        try {
            if (!deliver(session, Frame.server(greeting))) {
                return false;
            }
            for (ChatMessage past : history.snapshot()) {
                if (!deliver(session, past.toFrame())) {
                    return false;
                }
            }
            session.markJoined();
            return true;
        } finally {
            broadcastLock.unlock();
        }
    }

    /**
     * Only CHAT messages are retained; notices and rosters are transient.
     */
    public void historyAppend(ChatMessage message) {
        if (message.type() == MessageType.CHAT) {
            history.append(message);
        }
    }

    public List<ChatMessage> historySnapshot() {
        return history.snapshot();
    }

    public int historyCapacity() {
        return history.capacity();
    }

    public long broadcastCount() {
        return broadcasts.get();
    }

    public long deliveryFailures() {
        return deliveryFailures.get();
    }

    public static String encodeRoster(List<RosterEntry> roster) {
        return roster.stream().map(RosterEntry::encode).collect(Collectors.joining(","));
    }

    private DeliveryReport deliverToAll(Frame frame, ClientSession exclude) {
        int delivered = 0;
        int failed = 0;
        for (ClientSession session : registry.sessions()) {
            if (session == exclude || !session.joined()) {
                continue;
            }
            if (deliver(session, frame)) {
                delivered++;
            } else {
                failed++;
            }
        }
        broadcasts.incrementAndGet();
        return new DeliveryReport(delivered, failed);
    }

    private boolean deliver(ClientSession session, Frame frame) {
        try {
            session.connection().send(frame);
            return true;
        } catch (IOException e) {
            deliveryFailures.incrementAndGet();
            log.warn("Delivery to session {} ({}) failed: {}", session.id(), session.displayName(), e.getMessage());
            events.onEvent(ChatEvent.of(ChatEventType.NETWORK_ERROR, session.id(), session.address(), "write failed"));
            session.connection().abort();
            return false;
        }
    }
}
