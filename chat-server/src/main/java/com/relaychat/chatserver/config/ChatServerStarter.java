package com.relaychat.chatserver.config;

import com.relaychat.chatserver.broker.MessageBroker;
import com.relaychat.chatserver.events.ChatEventListener;
import com.relaychat.chatserver.events.ChatStatistics;
import com.relaychat.chatserver.events.CompositeChatEventListener;
import com.relaychat.chatserver.events.LoggingChatEventListener;
import com.relaychat.chatserver.security.ConnectionGate;
import com.relaychat.chatserver.security.InputValidator;
import com.relaychat.chatserver.security.RateLimiter;
import com.relaychat.chatserver.server.ChatServer;
import com.relaychat.chatserver.session.ClientRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;

/**
 * Wires the chat core from {@link ChatServerProperties} and starts the TCP server with the context.
 */
@Configuration
public class ChatServerStarter {
    private final ChatServerProperties properties;

    public ChatServerStarter(ChatServerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public InputValidator inputValidator() {
        return new InputValidator(properties.maxUsernameLength(), properties.maxMessageLength());
    }

    @Bean
    public ClientRegistry clientRegistry(InputValidator inputValidator) {
        return new ClientRegistry(inputValidator);
    }

    @Bean
    public ConnectionGate connectionGate() {
        return new ConnectionGate(properties.maxClients(), properties.maxConnectionsPerIp(),
                properties.connectionRatePerMinute(), properties.blockDuration(), Clock.systemUTC());
    }

    @Bean
    public RateLimiter rateLimiter() {
        ChatServerProperties.RateLimit limit = properties.rateLimit();
        return new RateLimiter(limit.capacity(), limit.refillTokens(), limit.refillPeriod());
    }

    @Bean
    public ChatStatistics chatStatistics() {
        return new ChatStatistics();
    }

    @Bean
    public LoggingChatEventListener loggingChatEventListener() {
        return new LoggingChatEventListener();
    }

    @Bean
    @Primary
    public ChatEventListener chatEventListener(ChatStatistics chatStatistics,
                                               LoggingChatEventListener loggingChatEventListener) {
        return new CompositeChatEventListener(List.of(chatStatistics, loggingChatEventListener));
    }

    @Bean
    public MessageBroker messageBroker(ClientRegistry clientRegistry, ChatEventListener chatEventListener) {
        return new MessageBroker(clientRegistry, properties.historySize(), chatEventListener);
    }

    @Bean(destroyMethod = "stop")
    public ChatServer chatServer(ClientRegistry clientRegistry,
                                 MessageBroker messageBroker,
                                 RateLimiter rateLimiter,
                                 ConnectionGate connectionGate,
                                 InputValidator inputValidator,
                                 ChatEventListener chatEventListener) {
        ChatServer server = new ChatServer(properties, clientRegistry, messageBroker, rateLimiter,
                connectionGate, inputValidator, chatEventListener);
        server.start();
        return server;
    }
}
