package com.relaychat.chatserver.session;

import com.relaychat.chatserver.security.InputValidator;
import com.relaychat.chatserver.security.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks live sessions and their usernames.
 * <p>
 * One monitor guards the whole registry: the uniqueness check and the insert of a username
 * are a single step, and every snapshot is a point-in-time copy. The underlying maps are never
 * handed out.
 */
public class ClientRegistry {
    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private final InputValidator validator;
    private final Clock clock;
    private final AtomicLong sessionIdCounter = new AtomicLong();

    // insertion order doubles as roster order
    private final Map<Long, ClientSession> sessions = new LinkedHashMap<>();
    private final Map<String, Long> sessionIdByUsername = new HashMap<>();

    public ClientRegistry(InputValidator validator) {
        this(validator, Clock.systemUTC());
    }

    public ClientRegistry(InputValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    public long register(ClientConnection connection, String ip, int port) {
        long id = sessionIdCounter.incrementAndGet();
        ClientSession session = new ClientSession(id, connection, ip, port, clock.instant());
        synchronized (this) {
            sessions.put(id, session);
        }
        log.info("Session {} registered from {} ({} active)", id, session.address(), size());
        return id;
    }

    public synchronized UsernameResult setUsername(long sessionId, String requested) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) {
            return UsernameResult.unknownSession();
        }
        String previous = session.displayName();
        ValidationResult validation = validator.validateUsername(requested);
        if (!validation.valid()) {
            return UsernameResult.invalid(previous, validation.error());
        }
        String name = validation.value();
        Long owner = sessionIdByUsername.get(name);
        if (owner != null) {
            return owner == sessionId
                    ? UsernameResult.unchanged(name)
                    : UsernameResult.duplicate(previous, name);
        }
        if (session.username() != null) {
            sessionIdByUsername.remove(session.username());
        }
        sessionIdByUsername.put(name, sessionId);
        session.username(name);
        session.touch(clock.instant());
        log.info("Session {} username {} -> {}", sessionId, previous, name);
        return UsernameResult.accepted(previous, name);
    }

    /**
     * Removes a session. Calling this for an id that is no longer present is a no-op.
     */
    public synchronized Optional<ClientSession> unregister(long sessionId) {
        ClientSession session = sessions.remove(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.username() != null) {
            sessionIdByUsername.remove(session.username(), sessionId);
        }
        log.info("Session {} ({}) unregistered ({} active)", sessionId, session.displayName(), sessions.size());
        return Optional.of(session);
    }

    public synchronized List<RosterEntry> snapshotUsers() {
        List<RosterEntry> roster = new ArrayList<>(sessions.size());
        for (ClientSession session : sessions.values()) {
            roster.add(new RosterEntry(session.displayName(), session.address()));
        }
        return roster;
    }

    public synchronized List<ClientSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    public synchronized Optional<ClientSession> find(long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public synchronized Optional<ClientSession> findByUsername(String username) {
        Long id = sessionIdByUsername.get(username);
        return id == null ? Optional.empty() : Optional.ofNullable(sessions.get(id));
    }

    public synchronized boolean recordActivity(long sessionId) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.touch(clock.instant());
        return true;
    }

    public synchronized boolean recordMessage(long sessionId) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.countMessage(clock.instant());
        return true;
    }

    public synchronized int size() {
        return sessions.size();
    }
}
