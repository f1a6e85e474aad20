package com.relaychat.chatserver.security;

/**
 * Outcome of {@link ConnectionGate#admit(String)}.
 */
public record AdmissionResult(boolean allowed, RejectReason reason) {
    private static final AdmissionResult ALLOWED = new AdmissionResult(true, null);

    public enum RejectReason {
        SERVER_FULL,
        TOO_MANY_FROM_IP,
        CONNECTION_RATE_EXCEEDED,
        IP_BLOCKED
    }

    public static AdmissionResult admitted() {
        return ALLOWED;
    }

    public static AdmissionResult rejected(RejectReason reason) {
        return new AdmissionResult(false, reason);
    }
}
