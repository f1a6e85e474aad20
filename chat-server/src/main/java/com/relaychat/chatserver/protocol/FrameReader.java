package com.relaychat.chatserver.protocol;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads newline-terminated frames from a blocking stream with a hard per-line byte limit.
 * Not thread-safe; owned by one connection worker.
 */
public class FrameReader {
    private final InputStream in;
    private final int maxFrameBytes;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);

    public FrameReader(InputStream in, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Returns the next line without its terminator, or {@code null} at end of stream.
     * An unterminated tail at end of stream is discarded.
     *
     * @throws FrameTooLongException if a line grows past the configured limit
     */
    public byte[] readLine() throws IOException {
        line.reset();
        int b;
        while ((b = in.read()) != -1) {
            if (b == FrameCodec.DELIMITER) {
                return line.toByteArray();
            }
            if (line.size() >= maxFrameBytes) {
                throw new FrameTooLongException(maxFrameBytes);
            }
            line.write(b);
        }
        return null;
    }

    /**
     * Reads and decodes the next frame, or returns {@code null} at end of stream.
     */
    public Frame readFrame() throws IOException {
        byte[] bytes = readLine();
        return bytes == null ? null : FrameCodec.decode(bytes);
    }
}
