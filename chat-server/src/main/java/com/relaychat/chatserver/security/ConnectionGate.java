package com.relaychat.chatserver.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Global and per-IP admission control for concurrent connections.
 * <p>
 * Every read and write of the counters happens under the gate's monitor, so the
 * check-then-increment in {@link #admit(String)} cannot let two callers pass on a stale count.
 */
public class ConnectionGate {
    private static final Logger log = LoggerFactory.getLogger(ConnectionGate.class);
    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final int maxConnections;
    private final int maxConnectionsPerIp;
    private final int maxConnectsPerMinute;
    private final Duration blockDuration;
    private final Clock clock;

    private final Map<String, ConnectionRecord> records = new HashMap<>();
    private final Map<String, Deque<Long>> recentConnects = new HashMap<>();
    private final Map<String, Long> blockedUntil = new HashMap<>();
    private int active;
    private long totalAdmitted;
    private long totalRejected;

    public ConnectionGate(int maxConnections, int maxConnectionsPerIp) {
        this(maxConnections, maxConnectionsPerIp, 0, Duration.ZERO, Clock.systemUTC());
    }

    public ConnectionGate(int maxConnections, int maxConnectionsPerIp, int maxConnectsPerMinute,
                          Duration blockDuration, Clock clock) {
        if (maxConnections <= 0 || maxConnectionsPerIp <= 0) {
            throw new IllegalArgumentException("Connection limits must be positive");
        }
        this.maxConnections = maxConnections;
        this.maxConnectionsPerIp = maxConnectionsPerIp;
        this.maxConnectsPerMinute = Math.max(0, maxConnectsPerMinute);
        this.blockDuration = blockDuration == null ? Duration.ZERO : blockDuration;
        this.clock = clock;
    }

    public synchronized AdmissionResult admit(String ip) {
        long now = clock.millis();

        Long until = blockedUntil.get(ip);
        if (until != null) {
            if (now < until) {
                return reject(ip, AdmissionResult.RejectReason.IP_BLOCKED);
            }
            blockedUntil.remove(ip);
        }
        if (active >= maxConnections) {
            return reject(ip, AdmissionResult.RejectReason.SERVER_FULL);
        }
        ConnectionRecord record = records.get(ip);
        if (record != null && record.count >= maxConnectionsPerIp) {
            return reject(ip, AdmissionResult.RejectReason.TOO_MANY_FROM_IP);
        }
        if (maxConnectsPerMinute > 0 && recordConnectAttempt(ip, now) > maxConnectsPerMinute) {
            if (!blockDuration.isZero()) {
                blockedUntil.put(ip, now + blockDuration.toMillis());
                log.warn("IP {} blocked for {} after exceeding {} connections per minute",
                        ip, blockDuration, maxConnectsPerMinute);
            }
            return reject(ip, AdmissionResult.RejectReason.CONNECTION_RATE_EXCEEDED);
        }

        records.computeIfAbsent(ip, ConnectionRecord::new).count++;
        active++;
        totalAdmitted++;
        return AdmissionResult.admitted();
    }

    /**
     * Returns one slot held by {@code ip}. Releasing an IP without an active connection is a no-op.
     */
    public synchronized void release(String ip) {
        ConnectionRecord record = records.get(ip);
        if (record == null) {
            return;
        }
        record.count--;
        active--;
        if (record.count <= 0) {
            records.remove(ip);
        }
    }

    public synchronized int activeConnections() {
        return active;
    }

    public synchronized int activeConnections(String ip) {
        ConnectionRecord record = records.get(ip);
        return record == null ? 0 : record.count;
    }

    public synchronized long totalAdmitted() {
        return totalAdmitted;
    }

    public synchronized long totalRejected() {
        return totalRejected;
    }

    /**
     * Drops connect-rate history and blocks that have expired.
     */
    public synchronized void purgeExpired() {
        long now = clock.millis();
        long cutoff = now - RATE_WINDOW.toMillis();
        recentConnects.values().forEach(attempts -> {
            while (!attempts.isEmpty() && attempts.peekFirst() <= cutoff) {
                attempts.pollFirst();
            }
        });
        recentConnects.values().removeIf(Deque::isEmpty);
        blockedUntil.values().removeIf(until -> until <= now);
    }

    private int recordConnectAttempt(String ip, long now) {
        Deque<Long> attempts = recentConnects.computeIfAbsent(ip, k -> new ArrayDeque<>());
        long cutoff = now - RATE_WINDOW.toMillis();
        while (!attempts.isEmpty() && attempts.peekFirst() <= cutoff) {
            attempts.pollFirst();
        }
        attempts.addLast(now);
        return attempts.size();
    }

    private AdmissionResult reject(String ip, AdmissionResult.RejectReason reason) {
        totalRejected++;
        log.debug("Rejected connection from {}: {}", ip, reason);
        return AdmissionResult.rejected(reason);
    }

    private static final class ConnectionRecord {
        final String ip;
        int count;

        ConnectionRecord(String ip) {
            this.ip = ip;
        }
    }
}
