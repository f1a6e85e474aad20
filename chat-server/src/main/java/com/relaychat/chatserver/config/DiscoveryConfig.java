package com.relaychat.chatserver.config;

import com.relaychat.chatserver.discovery.DiscoveryBroadcaster;
import com.relaychat.chatserver.server.ChatServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.SocketException;

@Configuration
@ConditionalOnProperty(prefix = "chat.server.discovery", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DiscoveryConfig {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryConfig.class);

    @Bean(destroyMethod = "stop")
    public DiscoveryBroadcaster discoveryBroadcaster(ChatServerProperties properties, ChatServer chatServer) {
        ChatServerProperties.Discovery discovery = properties.discovery();
        DiscoveryBroadcaster broadcaster =
                new DiscoveryBroadcaster(discovery.port(), chatServer.boundPort(), discovery.interval());
        try {
            broadcaster.start();
        } catch (SocketException e) {
            // the chat server runs without discovery
            log.error("Failed to start discovery broadcaster on port {}", discovery.port(), e);
        }
        return broadcaster;
    }
}
