package com.relaychat.chatserver.web;

import com.relaychat.chatserver.broker.MessageBroker;
import com.relaychat.chatserver.events.ChatStatistics;
import com.relaychat.chatserver.security.ConnectionGate;
import com.relaychat.chatserver.server.ChatServer;
import com.relaychat.chatserver.session.ClientRegistry;
import com.relaychat.chatserver.web.dto.ChatMessageDto;
import com.relaychat.chatserver.web.dto.OnlineUserDto;
import com.relaychat.chatserver.web.dto.ServerStatsDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of the running chat for operators.
 */
@RestController
@RequestMapping("/api/chat")
public class ChatAdminController {
    private final ChatServer chatServer;
    private final ClientRegistry registry;
    private final MessageBroker broker;
    private final ConnectionGate gate;
    private final ChatStatistics statistics;

    public ChatAdminController(ChatServer chatServer, ClientRegistry registry, MessageBroker broker,
                               ConnectionGate gate, ChatStatistics statistics) {
        this.chatServer = chatServer;
        this.registry = registry;
        this.broker = broker;
        this.gate = gate;
        this.statistics = statistics;
    }

    @GetMapping("/users")
    public List<OnlineUserDto> onlineUsers() {
        return registry.sessions().stream()
                .map(OnlineUserDto::fromSession)
                .toList();
    }

    @GetMapping("/messages")
    public List<ChatMessageDto> recentMessages() {
        return broker.historySnapshot().stream()
                .map(ChatMessageDto::fromMessage)
                .toList();
    }

    @GetMapping("/stats")
    public ServerStatsDto stats() {
        Map<String, Long> events = new TreeMap<>();
        statistics.snapshot().forEach((type, count) -> events.put(type.name(), count));
        return new ServerStatsDto(
                chatServer.state().name(),
                registry.size(),
                gate.totalAdmitted(),
                gate.totalRejected(),
                broker.broadcastCount(),
                broker.deliveryFailures(),
                broker.historySnapshot().size(),
                Duration.between(statistics.startedAt(), Instant.now()).toSeconds(),
                events);
    }
}
