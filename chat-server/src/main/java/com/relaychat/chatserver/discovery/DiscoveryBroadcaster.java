package com.relaychat.chatserver.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically announces the chat server on the LAN with a UDP broadcast of
 * {@code RELAY_CHAT_SERVER_DISCOVERY_V1|<tcp port>}.
 */
public class DiscoveryBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryBroadcaster.class);
    public static final String MAGIC = "RELAY_CHAT_SERVER_DISCOVERY_V1";
    private static final String BROADCAST_ADDRESS = "255.255.255.255";

    private final int discoveryPort;
    private final int chatPort;
    private final Duration interval;
    private final InetAddress target;

    private volatile DatagramSocket socket;
    private volatile boolean running;
    private ScheduledExecutorService scheduler;
    private long sent;

    public DiscoveryBroadcaster(int discoveryPort, int chatPort, Duration interval) {
        this(discoveryPort, chatPort, interval, broadcastAddress());
    }

    public DiscoveryBroadcaster(int discoveryPort, int chatPort, Duration interval, InetAddress target) {
        this.discoveryPort = discoveryPort;
        this.chatPort = chatPort;
        this.interval = interval;
        this.target = target;
    }

    public synchronized void start() throws SocketException {
        if (running) {
            log.warn("Discovery broadcaster already running");
            return;
        }
        socket = new DatagramSocket();
        socket.setBroadcast(true);
        running = true;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chat-discovery");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::announce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Announcing chat port {} on UDP {} every {}", chatPort, discoveryPort, interval);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
        if (socket != null && !socket.isClosed()) {
            socket.close();
        }
        log.info("Discovery broadcaster stopped after {} announcements", sentCount());
    }

    public static byte[] payload(int chatPort) {
        return (MAGIC + "|" + chatPort).getBytes(StandardCharsets.UTF_8);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized long sentCount() {
        return sent;
    }

    void announce() {
        if (!running) {
            return;
        }
        byte[] buffer = payload(chatPort);
        try {
            socket.send(new DatagramPacket(buffer, buffer.length, target, discoveryPort));
            synchronized (this) {
                sent++;
            }
            log.trace("Discovery announcement sent to {}:{}", target.getHostAddress(), discoveryPort);
        } catch (IOException e) {
            if (running) {
                log.warn("Discovery announcement failed: {}", e.getMessage());
            }
        }
    }

    private static InetAddress broadcastAddress() {
        try {
            return InetAddress.getByName(BROADCAST_ADDRESS);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Broadcast address unavailable", e);
        }
    }
}
