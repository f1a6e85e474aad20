package com.relaychat.chatserver.server;

import com.relaychat.chatserver.broker.ChatMessage;
import com.relaychat.chatserver.broker.MessageBroker;
import com.relaychat.chatserver.config.ChatServerProperties;
import com.relaychat.chatserver.events.ChatEvent;
import com.relaychat.chatserver.events.ChatEventListener;
import com.relaychat.chatserver.events.ChatEventType;
import com.relaychat.chatserver.security.AdmissionResult;
import com.relaychat.chatserver.security.ConnectionGate;
import com.relaychat.chatserver.security.InputValidator;
import com.relaychat.chatserver.security.RateLimiter;
import com.relaychat.chatserver.session.ClientRegistry;
import com.relaychat.chatserver.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accepts TCP clients and runs one {@link ConnectionWorker} per admitted connection.
 * <p>
 * Lifecycle: {@code INIT -> LISTENING -> SHUTTING_DOWN -> STOPPED}. {@link #start()} binds or
 * fails; {@link #stop()} stops accepting, tells every client, drains workers for up to the
 * configured shutdown timeout and then forces the rest closed.
 */
public class ChatServer {
    private static final Logger log = LoggerFactory.getLogger(ChatServer.class);
    private static final int ACCEPT_TIMEOUT_MILLIS = 1000;

    private final ChatServerProperties properties;
    private final ClientRegistry registry;
    private final MessageBroker broker;
    private final RateLimiter rateLimiter;
    private final ConnectionGate gate;
    private final InputValidator validator;
    private final ChatEventListener events;

    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.INIT);
    private final Set<ConnectionWorker> activeWorkers = ConcurrentHashMap.newKeySet();
    // outlives the worker until the writer task has stopped
    private final Set<SocketClientConnection> openConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger threadCounter = new AtomicInteger();

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private ScheduledExecutorService sweeper;
    private Thread acceptorThread;

    public ChatServer(ChatServerProperties properties,
                      ClientRegistry registry,
                      MessageBroker broker,
                      RateLimiter rateLimiter,
                      ConnectionGate gate,
                      InputValidator validator,
                      ChatEventListener events) {
        this.properties = properties;
        this.registry = registry;
        this.broker = broker;
        this.rateLimiter = rateLimiter;
        this.gate = gate;
        this.validator = validator;
        this.events = events == null ? ChatEventListener.NO_OP : events;
    }

    public synchronized void start() {
        if (state.get() != ServerState.INIT) {
            log.warn("Chat server already started (state {})", state.get());
            return;
        }
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.setSoTimeout(ACCEPT_TIMEOUT_MILLIS);
            socket.bind(new InetSocketAddress(InetAddress.getByName(properties.host()), properties.port()),
                    properties.maxClients());
            serverSocket = socket;
        } catch (IOException e) {
            state.set(ServerState.STOPPED);
            throw new ChatServerException("Cannot bind chat server to " + properties.host() + ":" + properties.port(), e);
        }

        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "chat-session-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chat-idle-sweeper");
            t.setDaemon(true);
            return t;
        });
        long sweepMillis = properties.idleSweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        state.set(ServerState.LISTENING);
        acceptorThread = new Thread(this::acceptLoop, "chat-acceptor");
        acceptorThread.setDaemon(true);
        acceptorThread.start();
        log.info("Chat server listening on {}:{} (max {} clients, {} per IP)",
                properties.host(), boundPort(), properties.maxClients(), properties.maxConnectionsPerIp());
    }

    public void stop() {
        if (!state.compareAndSet(ServerState.LISTENING, ServerState.SHUTTING_DOWN)) {
            state.compareAndSet(ServerState.INIT, ServerState.STOPPED);
            return;
        }
        log.info("Chat server shutting down, {} active sessions", activeWorkers.size());
        try {
            if (acceptorThread != null) {
                acceptorThread.join(ACCEPT_TIMEOUT_MILLIS * 2L);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sweeper.shutdownNow();

        broker.broadcastNotice("Server is shutting down.", null);
        for (ConnectionWorker worker : List.copyOf(activeWorkers)) {
            worker.requestClose("server shutdown");
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                List<ConnectionWorker> stragglers = new ArrayList<>(activeWorkers);
                log.warn("{} sessions did not finish within {}, forcing them closed",
                        stragglers.size(), properties.shutdownTimeout());
                for (ConnectionWorker worker : stragglers) {
                    log.debug("Forcing session at {} closed", worker.address());
                    worker.forceClose("shutdown timeout");
                }
                abortOpenConnections();
                workers.shutdownNow();
                if (!workers.awaitTermination(ACCEPT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                    log.warn("Session threads still running after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List.copyOf(activeWorkers).forEach(worker -> worker.forceClose("shutdown interrupted"));
            abortOpenConnections();
            workers.shutdownNow();
        }
        closeServerSocket();
        state.set(ServerState.STOPPED);
        log.info("Chat server stopped");
    }

    private void acceptLoop() {
        while (state.get() == ServerState.LISTENING) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (state.get() == ServerState.LISTENING) {
                    log.error("Accept failed", e);
                }
                continue;
            }
            handleAccepted(socket);
        }
        log.debug("Acceptor stopped");
    }

    private void handleAccepted(Socket socket) {
        String ip = socket.getInetAddress().getHostAddress();
        int port = socket.getPort();
        AdmissionResult admission = gate.admit(ip);
        if (!admission.allowed()) {
            log.info("Rejected connection from {}:{} ({})", ip, port, admission.reason());
            events.onEvent(ChatEvent.of(ChatEventType.REJECT, 0, ip + ":" + port, admission.reason().name()));
            closeQuietly(socket);
            return;
        }
        try {
            socket.setTcpNoDelay(true);
            ConnectionWorker worker = new ConnectionWorker(this, socket, ip, port);
            activeWorkers.add(worker);
            try {
                workers.execute(worker);
            } catch (RejectedExecutionException e) {
                activeWorkers.remove(worker);
                gate.release(ip);
                closeQuietly(socket);
                log.warn("Dropped connection from {}:{}: worker pool unavailable", ip, port);
            }
        } catch (IOException e) {
            gate.release(ip);
            closeQuietly(socket);
            log.warn("Could not configure socket from {}:{}: {}", ip, port, e.getMessage());
        }
    }

    /**
     * Aborts writers that outlived their session, typically blocked on a peer that stopped
     * reading.
     */
    private void abortOpenConnections() {
        List<SocketClientConnection> remaining = List.copyOf(openConnections);
        if (!remaining.isEmpty()) {
            log.warn("Aborting {} connections with unfinished writes", remaining.size());
            remaining.forEach(SocketClientConnection::abort);
        }
    }

    /**
     * Closes idle sessions, aborts sessions whose writes are stuck, and expires connect-rate
     * history.
     */
    void sweep() {
        try {
            Instant idleCutoff = Instant.now().minus(properties.idleTimeout());
            Duration writeTimeout = properties.writeTimeout();
            for (ConnectionWorker worker : List.copyOf(activeWorkers)) {
                ClientSession session = worker.session();
                if (session == null) {
                    continue;
                }
                if (worker.connection().isWriteStalled(writeTimeout)) {
                    log.warn("Session {} write stalled for over {}, dropping", session.id(), writeTimeout);
                    emit(ChatEventType.NETWORK_ERROR, session, "write timeout");
                    worker.connection().abort();
                } else if (session.lastActivity().isBefore(idleCutoff)) {
                    log.info("Session {} ({}) idle since {}, disconnecting",
                            session.id(), session.displayName(), session.lastActivity());
                    broker.sendDirect(session, ChatMessage.server("Disconnected due to inactivity."));
                    worker.requestClose("idle timeout");
                }
            }
            for (SocketClientConnection connection : List.copyOf(openConnections)) {
                if (connection.isOpen() || !connection.isWriteStalled(writeTimeout)) {
                    continue;
                }
                log.warn("Writer of a closed session stalled for over {}, aborting", writeTimeout);
                connection.abort();
            }
            gate.purgeExpired();
        } catch (RuntimeException e) {
            log.error("Idle sweep failed", e);
        }
    }

    void workerFinished(ConnectionWorker worker) {
        activeWorkers.remove(worker);
    }

    /**
     * Starts the writer of a new connection and tracks it until that writer stops.
     */
    void startWriter(SocketClientConnection connection) {
        openConnections.add(connection);
        connection.start(workers, () -> openConnections.remove(connection));
    }

    /**
     * Connections whose writer task has not stopped yet, including those of finished sessions.
     */
    int openConnections() {
        return openConnections.size();
    }

    void emit(ChatEventType type, ClientSession session, String detail) {
        events.onEvent(ChatEvent.of(type, session.id(), session.address(), detail));
    }

    public ServerState state() {
        return state.get();
    }

    /**
     * Port actually bound, which differs from the configured one when that is 0.
     */
    public int boundPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public int activeSessions() {
        return activeWorkers.size();
    }

    public ChatServerProperties properties() {
        return properties;
    }

    ClientRegistry registry() {
        return registry;
    }

    MessageBroker broker() {
        return broker;
    }

    RateLimiter rateLimiter() {
        return rateLimiter;
    }

    ConnectionGate gate() {
        return gate;
    }

    InputValidator validator() {
        return validator;
    }

    private void closeServerSocket() {
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.warn("Error closing server socket: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }
}
