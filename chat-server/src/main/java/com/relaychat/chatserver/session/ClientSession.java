package com.relaychat.chatserver.session;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One client's live connection plus its identity and activity state.
 * Instances are created and owned by {@link ClientRegistry}; the username is only
 * written under the registry's guard.
 */
public class ClientSession {
    private final long id;
    private final ClientConnection connection;
    private final String address;
    private final String ip;
    private final Instant connectedAt;
    private final AtomicLong messageCount = new AtomicLong();

    private volatile String username;
    private volatile Instant lastActivity;
    private volatile SessionState state = SessionState.ADMITTED;
    private volatile boolean joined;

    ClientSession(long id, ClientConnection connection, String ip, int port, Instant connectedAt) {
        this.id = id;
        this.connection = connection;
        this.ip = ip;
        this.address = ip + ":" + port;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public long id() {
        return id;
    }

    public ClientConnection connection() {
        return connection;
    }

    /**
     * Remote {@code host:port}.
     */
    public String address() {
        return address;
    }

    public String ip() {
        return ip;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public long messageCount() {
        return messageCount.get();
    }

    public String username() {
        return username;
    }

    public boolean hasUsername() {
        return username != null;
    }

    /**
     * The chosen username, or {@code User_<host:port>} until one is set.
     */
    public String displayName() {
        String name = username;
        return name != null ? name : "User_" + address;
    }

    public SessionState state() {
        return state;
    }

    public void state(SessionState state) {
        this.state = state;
    }

    /**
     * Whether the broker has delivered the welcome and history to this session.
     */
    public boolean joined() {
        return joined;
    }

    public void markJoined() {
        this.joined = true;
    }

    void username(String username) {
        this.username = username;
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    void countMessage(Instant now) {
        messageCount.incrementAndGet();
        this.lastActivity = now;
    }

    @Override
    public String toString() {
        return "ClientSession{id=" + id + ", name=" + displayName() + ", state=" + state + "}";
    }
}
