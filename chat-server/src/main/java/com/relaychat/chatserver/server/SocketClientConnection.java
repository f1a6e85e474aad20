package com.relaychat.chatserver.server;

import com.relaychat.chatserver.protocol.Frame;
import com.relaychat.chatserver.protocol.FrameCodec;
import com.relaychat.chatserver.session.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Socket-backed connection with a bounded outbound queue drained by its own writer task.
 * <p>
 * {@link #send(Frame)} only enqueues, so a slow peer never blocks the broadcaster. A full
 * queue is reported as a write failure, and a write that stays blocked is detected through
 * {@link #isWriteStalled(Duration)}.
 */
public class SocketClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(SocketClientConnection.class);
    private static final byte[] END_OF_STREAM = new byte[0];

    private final Socket socket;
    private final BlockingQueue<byte[]> writeQueue;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long writeStartedNanos;

    public SocketClientConnection(Socket socket, int queueCapacity) {
        this.socket = socket;
        this.writeQueue = new ArrayBlockingQueue<>(queueCapacity + 1);
    }

    /**
     * Starts the writer task. {@code onDrained} runs once the writer has stopped and the
     * socket is closed, or right away when the executor refuses the task.
     */
    public void start(Executor executor, Runnable onDrained) {
        try {
            executor.execute(() -> {
                try {
                    drain();
                } finally {
                    onDrained.run();
                }
            });
        } catch (RejectedExecutionException e) {
            abort();
            onDrained.run();
            throw e;
        }
    }

    @Override
    public void send(Frame frame) throws IOException {
        if (closed.get()) {
            throw new IOException("connection closed");
        }
        // one slot stays free for the end-of-stream marker
        if (writeQueue.remainingCapacity() <= 1 || !writeQueue.offer(FrameCodec.encode(frame))) {
            throw new IOException("outbound queue full");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.shutdownInput();
        } catch (IOException e) {
            log.debug("shutdownInput failed for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
        if (!writeQueue.offer(END_OF_STREAM)) {
            abort();
        }
    }

    @Override
    public void abort() {
        closed.set(true);
        writeQueue.clear();
        writeQueue.offer(END_OF_STREAM);
        closeSocket();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !socket.isClosed();
    }

    @Override
    public boolean isWriteStalled(Duration timeout) {
        long started = writeStartedNanos;
        return started != 0 && System.nanoTime() - started > timeout.toNanos();
    }

    private void drain() {
        try {
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());
            while (true) {
                byte[] data = writeQueue.take();
                if (data == END_OF_STREAM) {
                    break;
                }
                writeStartedNanos = System.nanoTime();
                out.write(data);
                if (writeQueue.isEmpty()) {
                    out.flush();
                }
                writeStartedNanos = 0;
            }
            out.flush();
        } catch (IOException e) {
            log.debug("Writer for {} stopped: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closed.set(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            writeStartedNanos = 0;
            closeSocket();
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
    }
}
