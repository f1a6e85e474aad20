package com.relaychat.chatserver.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Line-oriented codec for {@code TYPE|PAYLOAD\n} frames.
 * <p>
 * Decoding is lenient and never throws: malformed UTF-8 is replaced, a line without a
 * separator or with an unknown prefix is treated as raw chat text.
 */
public final class FrameCodec {
    public static final char SEPARATOR = '|';
    public static final char DELIMITER = '\n';

    private FrameCodec() {
    }

    public static String encodeToString(Frame frame) {
        return frame.type().prefix() + SEPARATOR + sanitizePayload(frame.payload()) + DELIMITER;
    }

    public static byte[] encode(Frame frame) {
        return encodeToString(frame).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes one line (with or without its trailing newline).
     */
    public static Frame decode(byte[] line) {
        if (line == null) {
            return Frame.chat("");
        }
        return decode(new String(line, StandardCharsets.UTF_8));
    }

    public static Frame decode(String line) {
        if (line == null) {
            return Frame.chat("");
        }
        String text = stripLineEnding(line);
        int idx = text.indexOf(SEPARATOR);
        if (idx < 0) {
            return Frame.chat(text);
        }
        Optional<FrameType> type = FrameType.fromPrefix(text.substring(0, idx));
        return type.map(t -> new Frame(t, text.substring(idx + 1)))
                .orElseGet(() -> Frame.chat(text));
    }

    static String sanitizePayload(String payload) {
        if (payload.indexOf('\n') < 0 && payload.indexOf('\r') < 0) {
            return payload;
        }
        return payload.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }

    private static String stripLineEnding(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') end--;
        if (end > 0 && line.charAt(end - 1) == '\r') end--;
        return line.substring(0, end);
    }
}
