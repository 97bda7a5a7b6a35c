package com.phillippitts.voicelink.presentation.websocket;

import com.phillippitts.voicelink.service.transport.MessageTransport;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts Spring's callback-driven {@link WebSocketSession} to the blocking
 * {@link MessageTransport} contract.
 *
 * <p>Container threads push inbound frames and the terminal close/error signal into an
 * unbounded FIFO queue; the connection's handler loop is the only consumer. Frames are
 * therefore handed to the loop in exactly the order the container delivered them.
 *
 * <p>Close statuses 1000 (normal), 1001 (going away) and 1005 (no status) count as a clean
 * close and make {@link #receive()} return {@code null}; any other status or a transport
 * error makes it throw.
 */
final class WebSocketSessionTransport implements MessageTransport {

    private static final Frame END_OF_STREAM = new Frame(null, null);

    private final WebSocketSession session;
    private final BlockingQueue<Frame> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminated = new AtomicBoolean();

    WebSocketSessionTransport(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    /** Queues a text frame received by the container. Ignored once the stream has ended. */
    void deliver(String payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (!terminated.get()) {
            inbound.add(new Frame(payload, null));
        }
    }

    /** Signals that the container closed the session. Only the first terminal signal counts. */
    void closed(CloseStatus status) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        if (isCleanClose(status)) {
            inbound.add(END_OF_STREAM);
        } else {
            inbound.add(new Frame(null, new IOException("Connection closed abnormally: " + status)));
        }
    }

    /** Signals a transport-level failure reported by the container. */
    void failed(Throwable error) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        IOException io = error instanceof IOException e ? e : new IOException(error.getMessage(), error);
        inbound.add(new Frame(null, io));
    }

    @Override
    public String receive() throws IOException {
        Frame frame;
        try {
            frame = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException io = new InterruptedIOException("Interrupted while waiting for a message");
            io.initCause(e);
            throw io;
        }
        if (frame.isTerminal()) {
            // keep the terminal signal visible to any later receive call
            inbound.add(frame);
            if (frame.error() != null) {
                throw frame.error();
            }
            return null;
        }
        return frame.payload();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (session.isOpen()) {
            session.close(CloseStatus.NORMAL);
        }
    }

    static boolean isCleanClose(CloseStatus status) {
        if (status == null) {
            return false;
        }
        int code = status.getCode();
        return code == CloseStatus.NORMAL.getCode()
                || code == CloseStatus.GOING_AWAY.getCode()
                || code == CloseStatus.NO_STATUS_CODE.getCode();
    }

    private record Frame(String payload, IOException error) {
        boolean isTerminal() {
            return payload == null;
        }
    }
}
