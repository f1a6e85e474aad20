package com.relaychat.chatserver.protocol;

import java.util.Optional;

/**
 * Frame prefixes understood on the wire.
 */
public enum FrameType {
    CHAT("MSG"),
    SERVER("SRV"),
    USER_LIST("ULIST"),
    COMMAND("CMD"),
    USER_COMMAND("CMD_USER");

    private final String prefix;

    FrameType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static Optional<FrameType> fromPrefix(String prefix) {
        for (FrameType type : values()) {
            if (type.prefix.equals(prefix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
