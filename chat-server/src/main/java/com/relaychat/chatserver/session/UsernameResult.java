package com.relaychat.chatserver.session;

/**
 * Outcome of {@link ClientRegistry#setUsername(long, String)}.
 *
 * @param previousName display name before the change (for notices)
 * @param username     the accepted name, when the outcome is {@code ACCEPTED} or {@code UNCHANGED}
 * @param reason       sender-facing reason for {@code INVALID_FORMAT}
 */
public record UsernameResult(Outcome outcome, String previousName, String username, String reason) {

    public enum Outcome {
        ACCEPTED,
        UNCHANGED,
        DUPLICATE,
        INVALID_FORMAT,
        UNKNOWN_SESSION
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }

    static UsernameResult accepted(String previousName, String username) {
        return new UsernameResult(Outcome.ACCEPTED, previousName, username, null);
    }

    static UsernameResult unchanged(String username) {
        return new UsernameResult(Outcome.UNCHANGED, username, username, null);
    }

    static UsernameResult duplicate(String previousName, String requested) {
        return new UsernameResult(Outcome.DUPLICATE, previousName, requested, null);
    }

    static UsernameResult invalid(String previousName, String reason) {
        return new UsernameResult(Outcome.INVALID_FORMAT, previousName, null, reason);
    }

    static UsernameResult unknownSession() {
        return new UsernameResult(Outcome.UNKNOWN_SESSION, null, null, null);
    }
}
