package com.relaychat.chatserver.web;

import com.relaychat.chatserver.server.ChatServer;
import com.relaychat.chatserver.server.ServerState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Reports whether the TCP chat listener is up.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final ChatServer chatServer;

    public HealthController(ChatServer chatServer) {
        this.chatServer = chatServer;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        ServerState state = chatServer.state();
        Map<String, Object> body = Map.of(
                "status", state == ServerState.LISTENING ? "UP" : "DOWN",
                "chat", Map.of(
                        "state", state.name(),
                        "port", chatServer.boundPort(),
                        "sessions", chatServer.activeSessions()));
        HttpStatus status = state == ServerState.LISTENING ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }
}
