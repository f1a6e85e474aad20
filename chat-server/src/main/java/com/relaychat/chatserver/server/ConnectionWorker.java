package com.relaychat.chatserver.server;

import com.relaychat.chatserver.broker.ChatMessage;
import com.relaychat.chatserver.broker.MessageBroker;
import com.relaychat.chatserver.events.ChatEventType;
import com.relaychat.chatserver.protocol.Frame;
import com.relaychat.chatserver.protocol.FrameCodec;
import com.relaychat.chatserver.protocol.FrameReader;
import com.relaychat.chatserver.protocol.FrameTooLongException;
import com.relaychat.chatserver.security.RateLimiter;
import com.relaychat.chatserver.security.ValidationResult;
import com.relaychat.chatserver.session.ClientRegistry;
import com.relaychat.chatserver.session.ClientSession;
import com.relaychat.chatserver.session.SessionState;
import com.relaychat.chatserver.session.UsernameResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves one admitted connection: registers the session, reads frames until the peer goes
 * away, and tears the session down exactly once.
 */
class ConnectionWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionWorker.class);

    static final String HELP_TEXT =
            "Commands: /nick <name> change your name, /users list who is online, /quit leave the chat, /help this text.";

    private final ChatServer server;
    private final Socket socket;
    private final String ip;
    private final int port;
    private final SocketClientConnection connection;
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    private volatile ClientSession session;
    private volatile String closeReason;

    ConnectionWorker(ChatServer server, Socket socket, String ip, int port) {
        this.server = server;
        this.socket = socket;
        this.ip = ip;
        this.port = port;
        this.connection = new SocketClientConnection(socket, server.properties().outboundQueueSize());
    }

    @Override
    public void run() {
        ClientRegistry registry = server.registry();
        MessageBroker broker = server.broker();
        long id = registry.register(connection, ip, port);
        session = registry.find(id).orElse(null);
        if (session == null) {
            cleanup("registration lost");
            return;
        }
        String reason = "disconnected";
        try {
            server.startWriter(connection);
            server.emit(ChatEventType.CONNECT, session, null);

            session.state(SessionState.AUTHENTICATING);
            if (!broker.welcome(session, "Welcome to the chat, " + session.displayName() + "!")) {
                reason = "welcome failed";
                return;
            }
            broker.broadcastNotice(session.displayName() + " has joined the chat.", session);
            broker.broadcastRoster();

            FrameReader reader = new FrameReader(socket.getInputStream(), server.properties().maxFrameBytes());
            byte[] line;
            while ((line = reader.readLine()) != null) {
                if (!handleLine(line)) {
                    reason = "quit";
                    break;
                }
            }
        } catch (FrameTooLongException e) {
            reason = "protocol error";
            server.emit(ChatEventType.PROTOCOL_ERROR, session, e.getMessage());
            broker.sendDirect(session, ChatMessage.server("Message too long, closing connection."));
        } catch (IOException e) {
            reason = "connection lost";
            if (closeReason == null && server.state() == ServerState.LISTENING) {
                log.debug("Read failed for session {}: {}", id, e.getMessage());
                server.emit(ChatEventType.NETWORK_ERROR, session, e.getMessage());
            }
        } catch (RuntimeException e) {
            reason = "internal error";
            log.error("Session {} failed", id, e);
        } finally {
            cleanup(closeReason != null ? closeReason : reason);
        }
    }

    /**
     * Handles one received line. Returns {@code false} when the client asked to leave.
     */
    boolean handleLine(byte[] line) {
        if (isBlank(line)) {
            return true;
        }
        Frame frame = FrameCodec.decode(line);
        RateLimiter.Decision decision = server.rateLimiter().acquire(session.id(), 1);
        if (!decision.allowed()) {
            if (decision == RateLimiter.Decision.THROTTLED) {
                server.emit(ChatEventType.THROTTLE, session, "frame dropped");
                notice("You are sending messages too fast. Please slow down.");
            }
            return true;
        }
        switch (frame.type()) {
            case USER_COMMAND -> changeUsername(frame.payload());
            case CHAT -> chat(frame.payload());
            case COMMAND -> {
                return command(frame.payload());
            }
            default -> {
                server.emit(ChatEventType.VALIDATION_ERROR, session, "unsupported frame " + frame.type());
                notice("Unsupported frame type.");
            }
        }
        return true;
    }

    private void changeUsername(String requested) {
        UsernameResult result = server.registry().setUsername(session.id(), requested);
        switch (result.outcome()) {
            case ACCEPTED -> {
                activate();
                server.emit(ChatEventType.USERNAME_CHANGE, session, result.previousName() + " -> " + result.username());
                server.broker().broadcastNotice(result.previousName() + " is now known as " + result.username() + ".", null);
                server.broker().broadcastRoster();
            }
            case UNCHANGED -> {
                activate();
                notice("You are already known as " + result.username() + ".");
            }
            case DUPLICATE -> {
                server.emit(ChatEventType.VALIDATION_ERROR, session, "duplicate username " + result.username());
                notice("Username '" + result.username() + "' is already taken.");
            }
            case INVALID_FORMAT -> {
                server.emit(ChatEventType.VALIDATION_ERROR, session, "invalid username");
                notice(result.reason());
            }
            case UNKNOWN_SESSION -> log.debug("Username change for departed session {}", session.id());
        }
    }

    private void chat(String payload) {
        ValidationResult validation = server.validator().validateMessage(stripOwnPrefix(payload));
        if (!validation.valid()) {
            server.emit(ChatEventType.VALIDATION_ERROR, session, "invalid message");
            notice(validation.error());
            return;
        }
        activate();
        server.registry().recordMessage(session.id());
        server.broker().publish(ChatMessage.chat(session.displayName(), validation.value()));
        server.emit(ChatEventType.MESSAGE, session, validation.value().length() + " chars");
    }

    private boolean command(String payload) {
        String text = payload.strip();
        if (text.startsWith("/")) {
            text = text.substring(1);
        }
        String[] parts = text.split("\\s+", 2);
        String name = parts[0].toLowerCase(Locale.ROOT);
        server.registry().recordActivity(session.id());
        switch (name) {
            case "quit", "exit" -> {
                notice("Goodbye.");
                return false;
            }
            case "help" -> notice(HELP_TEXT);
            case "nick" -> {
                if (parts.length < 2 || parts[1].isBlank()) {
                    notice("Usage: /nick <name>");
                } else {
                    changeUsername(parts[1]);
                }
            }
            case "users", "who" -> server.broker().sendDirect(session,
                    ChatMessage.userList(MessageBroker.encodeRoster(server.registry().snapshotUsers())));
            default -> {
                server.emit(ChatEventType.VALIDATION_ERROR, session, "unknown command");
                notice("Unknown command. Type /help for a list of commands.");
            }
        }
        return true;
    }

    /**
     * Compatible clients prefix their own name ({@code MSG|alice: hi}); the server adds the
     * authoritative one, so a matching prefix is dropped.
     */
    private String stripOwnPrefix(String payload) {
        String prefix = session.displayName() + ": ";
        return payload.startsWith(prefix) ? payload.substring(prefix.length()) : payload;
    }

    private void activate() {
        server.registry().recordActivity(session.id());
        if (session.state() == SessionState.AUTHENTICATING) {
            session.state(SessionState.ACTIVE);
        }
    }

    private void notice(String text) {
        server.broker().sendDirect(session, ChatMessage.server(text));
    }

    /**
     * Asks the worker to finish: flushes queued output and unblocks the reader.
     */
    void requestClose(String reason) {
        if (closeReason == null) {
            closeReason = reason;
        }
        connection.close();
    }

    /**
     * Drops the connection without flushing and runs cleanup from the calling thread.
     */
    void forceClose(String reason) {
        if (closeReason == null) {
            closeReason = reason;
        }
        connection.abort();
        cleanup(reason);
    }

    /**
     * Runs at most once, from whichever path gets here first.
     */
    void cleanup(String reason) {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        ClientSession current = session;
        if (current != null) {
            current.state(SessionState.CLOSING);
            boolean removed = server.registry().unregister(current.id()).isPresent();
            server.rateLimiter().remove(current.id());
            if (removed && current.joined() && server.state() == ServerState.LISTENING) {
                server.broker().broadcastNotice(current.displayName() + " has left the chat.", null);
                server.broker().broadcastRoster();
            }
            server.emit(ChatEventType.DISCONNECT, current, reason);
        }
        server.gate().release(ip);
        if (connection.isWriteStalled(server.properties().writeTimeout())) {
            connection.abort();
        } else {
            connection.close();
        }
        server.workerFinished(this);
    }

    ClientSession session() {
        return session;
    }

    SocketClientConnection connection() {
        return connection;
    }

    String address() {
        return ip + ":" + port;
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
