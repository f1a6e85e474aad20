package com.relaychat.chatserver.security;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation and sanitizing of usernames and chat text.
 */
public class InputValidator {
    private static final Pattern USERNAME_CHARS = Pattern.compile("[A-Za-z0-9_.\\-]+");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\t]]");
    private static final Set<String> RESERVED_NAMES =
            Set.of("admin", "server", "system", "bot", "null", "undefined");

    private final int maxUsernameLength;
    private final int maxMessageLength;

    public InputValidator(int maxUsernameLength, int maxMessageLength) {
        this.maxUsernameLength = maxUsernameLength;
        this.maxMessageLength = maxMessageLength;
    }

    /**
     * Usernames are trimmed, then must be 1..max characters of letters, digits, {@code _ - .}
     * and must not be a reserved name. Overlong names are rejected, never truncated.
     */
    public ValidationResult validateUsername(String raw) {
        String name = raw == null ? "" : raw.strip();
        if (name.isEmpty()) {
            return ValidationResult.invalid("Username cannot be empty.");
        }
        if (name.length() > maxUsernameLength) {
            return ValidationResult.invalid("Username too long (max " + maxUsernameLength + " characters).");
        }
        if (!USERNAME_CHARS.matcher(name).matches()) {
            return ValidationResult.invalid("Username may only contain letters, digits, '_', '-' and '.'.");
        }
        if (RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
            return ValidationResult.invalid("Username '" + name + "' is reserved.");
        }
        return ValidationResult.ok(name);
    }

    /**
     * Control characters are removed and surrounding whitespace trimmed before the checks.
     */
    public ValidationResult validateMessage(String raw) {
        String text = raw == null ? "" : CONTROL_CHARS.matcher(raw).replaceAll("").strip();
        if (text.isEmpty()) {
            return ValidationResult.invalid("Message cannot be empty.");
        }
        if (text.length() > maxMessageLength) {
            return ValidationResult.invalid("Message too long (max " + maxMessageLength + " characters).");
        }
        return ValidationResult.ok(text);
    }
}
