package com.relaychat.chatserver.server;

import com.relaychat.chatserver.broker.MessageBroker;
import com.relaychat.chatserver.config.ChatServerProperties;
import com.relaychat.chatserver.events.ChatEventType;
import com.relaychat.chatserver.events.ChatStatistics;
import com.relaychat.chatserver.security.ConnectionGate;
import com.relaychat.chatserver.security.InputValidator;
import com.relaychat.chatserver.security.RateLimiter;
import com.relaychat.chatserver.session.ClientRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatServerIntegrationTest {
    private static final int FLOOD_MESSAGES = 8_000;

    private final List<ChatServer> servers = new ArrayList<>();
    private final List<ChatTestClient> clients = new ArrayList<>();
    private ClientRegistry registry;
    private ChatStatistics statistics;

    @AfterEach
    void tearDown() throws IOException {
        for (ChatTestClient client : clients) {
            client.close();
        }
        servers.forEach(ChatServer::stop);
    }

    private ChatServer startServer(ChatServerProperties properties) {
        ChatServer server = newServer(properties);
        server.start();
        return server;
    }

    private ChatServer newServer(ChatServerProperties properties) {
        InputValidator validator = new InputValidator(properties.maxUsernameLength(), properties.maxMessageLength());
        registry = new ClientRegistry(validator);
        statistics = new ChatStatistics();
        MessageBroker broker = new MessageBroker(registry, properties.historySize(), statistics);
        ChatServerProperties.RateLimit limit = properties.rateLimit();
        RateLimiter rateLimiter = new RateLimiter(limit.capacity(), limit.refillTokens(), limit.refillPeriod());
        ConnectionGate gate = new ConnectionGate(properties.maxClients(), properties.maxConnectionsPerIp());
        ChatServer server = new ChatServer(properties, registry, broker, rateLimiter, gate, validator, statistics);
        servers.add(server);
        return server;
    }

    private static ChatServerProperties properties(int port, int maxClients, ChatServerProperties.RateLimit rateLimit,
                                                   int maxFrameBytes, Duration idleTimeout, Duration sweepInterval) {
        return properties(port, maxClients, rateLimit, maxFrameBytes, idleTimeout, sweepInterval,
                Duration.ofSeconds(10), 256);
    }

    private static ChatServerProperties properties(int port, int maxClients, ChatServerProperties.RateLimit rateLimit,
                                                   int maxFrameBytes, Duration idleTimeout, Duration sweepInterval,
                                                   Duration writeTimeout, int outboundQueueSize) {
        return new ChatServerProperties("127.0.0.1", port, maxClients, 10, 0, Duration.ZERO,
                rateLimit, 50, idleTimeout, sweepInterval, writeTimeout, Duration.ofSeconds(2),
                maxFrameBytes, 50, 1000, outboundQueueSize,
                new ChatServerProperties.Discovery(false, 8081, Duration.ofSeconds(5)));
    }

    /**
     * Generous rate limit and a deep outbound queue, so only a blocked write can end a session.
     */
    private static ChatServerProperties floodable(Duration writeTimeout, Duration sweepInterval) {
        return properties(0, 20, new ChatServerProperties.RateLimit(100_000, 100_000, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), sweepInterval, writeTimeout, 20_000);
    }

    /**
     * A client that never reads, with a receive window small enough for the server's writes to
     * block once its send buffer is full.
     */
    private static Socket connectSilently(ChatServer server) throws IOException {
        Socket socket = new Socket();
        socket.setReceiveBufferSize(1024);
        socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), server.boundPort()));
        return socket;
    }

    /**
     * Sends enough large chat lines to overrun any socket buffer and waits until the sender's
     * own echo of the last one comes back.
     */
    private static void flood(ChatTestClient sender, String name) throws IOException {
        String padding = "p".repeat(900);
        CompletableFuture<Void> writes = CompletableFuture.runAsync(() -> {
            try {
                for (int i = 0; i < FLOOD_MESSAGES; i++) {
                    sender.send("MSG|m" + i + " " + padding);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        sender.awaitLine("MSG|" + name + ": m" + (FLOOD_MESSAGES - 1) + " " + padding);
        writes.join();
    }

    private static ChatServerProperties defaults() {
        return properties(0, 20, new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), Duration.ofSeconds(15));
    }

    private ChatTestClient connect(ChatServer server) throws IOException {
        ChatTestClient client = new ChatTestClient(server.boundPort());
        clients.add(client);
        return client;
    }

    /**
     * Connects and reads up to the roster that follows the welcome.
     */
    private ChatTestClient join(ChatServer server, String username) throws IOException {
        ChatTestClient client = connect(server);
        client.awaitLine(line -> line.startsWith("ULIST|"));
        if (username != null) {
            client.send("CMD_USER|" + username);
            client.awaitLine(line -> line.endsWith(" is now known as " + username + "."));
        }
        return client;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    @Test
    void newClientIsWelcomedAndListed() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient client = connect(server);

        String welcome = client.readLine();
        String roster = client.readLine();

        assertThat(server.state()).isEqualTo(ServerState.LISTENING);
        assertThat(welcome).startsWith("SRV|Welcome to the chat, User_127.0.0.1:").endsWith("!");
        assertThat(roster).startsWith("ULIST|User_127.0.0.1:").contains("(127.0.0.1:");
    }

    @Test
    void chatIsBroadcastToEveryoneIncludingSender() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");
        ChatTestClient bob = join(server, null);
        alice.awaitLine(line -> line.endsWith(" has joined the chat."));
        bob.send("CMD_USER|bob");
        alice.awaitLine(line -> line.endsWith(" is now known as bob."));

        alice.send("MSG|alice: hello everyone");

        assertThat(bob.awaitLine(line -> line.startsWith("MSG|"))).isEqualTo("MSG|alice: hello everyone");
        assertThat(alice.awaitLine(line -> line.startsWith("MSG|"))).isEqualTo("MSG|alice: hello everyone");
    }

    @Test
    void lineWithoutPrefixIsTreatedAsChat() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");

        alice.send("plain text line");

        assertThat(alice.awaitLine(line -> line.startsWith("MSG|"))).isEqualTo("MSG|alice: plain text line");
    }

    @Test
    void lateJoinerReceivesHistoryRightAfterWelcome() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");
        alice.send("MSG|first");
        alice.awaitLine("MSG|alice: first");

        ChatTestClient carol = connect(server);

        assertThat(carol.readLine()).startsWith("SRV|Welcome to the chat, ");
        assertThat(carol.readLine()).isEqualTo("MSG|alice: first");
        assertThat(carol.readLine()).startsWith("ULIST|alice(127.0.0.1:");
    }

    @Test
    void duplicateAndInvalidNamesAreRefused() throws IOException {
        ChatServer server = startServer(defaults());
        join(server, "alice");
        ChatTestClient other = join(server, null);

        other.send("CMD_USER|alice");
        assertThat(other.awaitLine(line -> line.startsWith("SRV|"))).isEqualTo("SRV|Username 'alice' is already taken.");

        other.send("CMD_USER|admin");
        assertThat(other.awaitLine(line -> line.startsWith("SRV|"))).isEqualTo("SRV|Username 'admin' is reserved.");

        other.send("CMD|/nick alice2");
        assertThat(other.awaitLine(line -> line.startsWith("SRV|"))).endsWith(" is now known as alice2.");
        assertThat(registry.findByUsername("alice2")).isPresent();
    }

    @Test
    void commandsAreAnswered() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");

        alice.send("CMD|/users");
        assertThat(alice.awaitLine(line -> line.startsWith("ULIST|"))).startsWith("ULIST|alice(127.0.0.1:");

        alice.send("CMD|/help");
        assertThat(alice.awaitLine(line -> line.startsWith("SRV|"))).isEqualTo("SRV|" + ConnectionWorker.HELP_TEXT);

        alice.send("CMD|/dance");
        assertThat(alice.awaitLine(line -> line.startsWith("SRV|")))
                .isEqualTo("SRV|Unknown command. Type /help for a list of commands.");
    }

    @Test
    void serverFramesFromClientsAreRefusedAndBlankLinesIgnored() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");

        alice.send("");
        alice.send("   ");
        alice.send("SRV|I am the server now");

        assertThat(alice.awaitLine(line -> line.startsWith("SRV|"))).isEqualTo("SRV|Unsupported frame type.");
    }

    @Test
    void invalidMessageIsReportedOnlyToSender() throws IOException {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");

        alice.send("MSG|" + "x".repeat(1001));

        assertThat(alice.awaitLine(line -> line.startsWith("SRV|")))
                .isEqualTo("SRV|Message too long (max 1000 characters).");
    }

    @Test
    void quitClosesSessionAndNotifiesOthers() throws Exception {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");
        ChatTestClient bob = join(server, "bob");

        bob.send("CMD|/quit");

        assertThat(bob.awaitLine(line -> line.startsWith("SRV|Goodbye"))).isEqualTo("SRV|Goodbye.");
        assertThat(bob.awaitClosed()).isTrue();
        alice.awaitLine("SRV|bob has left the chat.");
        waitUntil(() -> statistics.count(ChatEventType.DISCONNECT) == 1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.findByUsername("bob")).isEmpty();
    }

    @Test
    void abruptDisconnectIsCleanedUp() throws Exception {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");
        ChatTestClient bob = join(server, "bob");

        bob.close();

        alice.awaitLine("SRV|bob has left the chat.");
        waitUntil(() -> server.activeSessions() == 1);
    }

    @Test
    void connectionsBeyondCapacityAreClosed() throws Exception {
        ChatServer server = startServer(properties(0, 1, new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), Duration.ofSeconds(15)));
        join(server, "alice");

        ChatTestClient rejected = connect(server);

        assertThat(rejected.awaitClosed()).isTrue();
        assertThat(rejected.received()).isEmpty();
        waitUntil(() -> statistics.count(ChatEventType.REJECT) == 1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void oversizedFrameEndsTheSession() throws Exception {
        ChatServer server = startServer(properties(0, 20, new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                64, Duration.ofMinutes(30), Duration.ofSeconds(15)));
        ChatTestClient client = join(server, null);

        client.sendRaw("MSG|" + "y".repeat(200) + "\n");

        assertThat(client.awaitClosed()).isTrue();
        waitUntil(() -> registry.size() == 0);
        assertThat(statistics.count(ChatEventType.PROTOCOL_ERROR)).isEqualTo(1);
    }

    @Test
    void floodingClientIsThrottled() throws IOException {
        ChatServer server = startServer(properties(0, 20, new ChatServerProperties.RateLimit(3, 3, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), Duration.ofSeconds(15)));
        ChatTestClient alice = join(server, "alice");

        for (int i = 0; i < 5; i++) {
            alice.send("MSG|spam " + i);
        }

        // the username frame already spent one of the three tokens
        alice.awaitLine("SRV|You are sending messages too fast. Please slow down.");
        assertThat(alice.received()).contains("MSG|alice: spam 0", "MSG|alice: spam 1")
                .doesNotContain("MSG|alice: spam 2");
    }

    @Test
    void idleSessionIsDisconnected() throws IOException {
        ChatServer server = startServer(properties(0, 20, new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                4096, Duration.ofMillis(300), Duration.ofMillis(100)));
        ChatTestClient idle = connect(server);

        idle.awaitLine("SRV|Disconnected due to inactivity.");

        assertThat(idle.awaitClosed()).isTrue();
    }

    @Test
    void stopNotifiesClientsAndClosesEverything() throws Exception {
        ChatServer server = startServer(defaults());
        ChatTestClient alice = join(server, "alice");
        ChatTestClient bob = join(server, "bob");

        server.stop();

        assertThat(server.state()).isEqualTo(ServerState.STOPPED);
        alice.awaitLine("SRV|Server is shutting down.");
        bob.awaitLine("SRV|Server is shutting down.");
        assertThat(alice.awaitClosed()).isTrue();
        assertThat(bob.awaitClosed()).isTrue();
        assertThat(alice.received()).doesNotContain("SRV|bob has left the chat.");
        waitUntil(() -> registry.size() == 0);
    }

    @Test
    void stalledReaderIsDroppedWhileOthersKeepReceiving() throws Exception {
        ChatServer server = startServer(floodable(Duration.ofMillis(500), Duration.ofMillis(100)));
        try (Socket silent = connectSilently(server)) {
            waitUntil(() -> registry.size() == 1);
            ChatTestClient fast = join(server, "fast");

            flood(fast, "fast");

            waitUntil(() -> registry.size() == 1 && server.openConnections() == 1);
            assertThat(registry.findByUsername("fast")).isPresent();
            assertThat(statistics.count(ChatEventType.NETWORK_ERROR)).isPositive();

            fast.send("MSG|still here");
            fast.awaitLine("MSG|fast: still here");
        }
    }

    @Test
    void stopAbortsWriterLeftBlockedAfterItsSessionEnded() throws Exception {
        ChatServer server = startServer(floodable(Duration.ofSeconds(60), Duration.ofSeconds(15)));
        try (Socket silent = connectSilently(server)) {
            waitUntil(() -> registry.size() == 1);
            ChatTestClient fast = join(server, "fast");
            flood(fast, "fast");

            OutputStream out = silent.getOutputStream();
            out.write("CMD|/quit\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            waitUntil(() -> registry.size() == 1 && server.activeSessions() == 1);
            // the departed session's writer is still stuck behind the unread backlog
            assertThat(server.openConnections()).isEqualTo(2);

            server.stop();

            assertThat(server.state()).isEqualTo(ServerState.STOPPED);
            waitUntil(() -> server.openConnections() == 0);
        }
    }

    @Test
    void sessionThatFailsItsWelcomeLeavesWithoutNotice() throws Exception {
        ChatServer server = startServer(properties(0, 20, new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), Duration.ofSeconds(15), Duration.ofSeconds(10), 3));
        ChatTestClient alice = join(server, "alice");
        for (int i = 0; i < 5; i++) {
            alice.send("MSG|history " + i);
            alice.awaitLine("MSG|alice: history " + i);
        }

        // greeting plus five history lines cannot fit a three-frame queue
        ChatTestClient newcomer = connect(server);
        assertThat(newcomer.awaitClosed()).isTrue();
        waitUntil(() -> statistics.count(ChatEventType.DISCONNECT) == 1);

        alice.send("MSG|after");
        alice.awaitLine("MSG|alice: after");
        assertThat(alice.received())
                .noneMatch(line -> line.endsWith(" has left the chat."))
                .noneMatch(line -> line.endsWith(" has joined the chat."));
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void bindFailureIsReported() {
        ChatServer first = startServer(defaults());
        ChatServer second = newServer(properties(first.boundPort(), 20,
                new ChatServerProperties.RateLimit(60, 60, Duration.ofMinutes(1)),
                4096, Duration.ofMinutes(30), Duration.ofSeconds(15)));

        assertThatThrownBy(second::start).isInstanceOf(ChatServerException.class);
        assertThat(second.state()).isEqualTo(ServerState.STOPPED);
    }
}
