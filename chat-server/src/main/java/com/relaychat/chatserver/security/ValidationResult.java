package com.relaychat.chatserver.security;

/**
 * Result of validating user-supplied text. {@code value} holds the sanitized input when valid,
 * {@code error} a short reason suitable for the sender when not.
 */
public record ValidationResult(boolean valid, String value, String error) {

    public static ValidationResult ok(String value) {
        return new ValidationResult(true, value, null);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, null, error);
    }
}
