package com.phillippitts.voicelink.service.transport;

import java.io.IOException;

/**
 * Blocking, message-oriented view of one client connection.
 *
 * <p>Exactly one thread (the connection's handler loop) calls {@link #receive()} and
 * {@link #send(String)}; implementations need not support concurrent receivers or senders.
 * Neither call imposes a timeout.
 */
public interface MessageTransport {

    /**
     * Blocks until the next text message arrives.
     *
     * @return the message text, or {@code null} once the peer has closed the connection cleanly
     * @throws IOException if the connection failed or the waiting thread was interrupted
     */
    String receive() throws IOException;

    /**
     * Writes one text message.
     *
     * @throws IOException if the connection is closed or the write failed
     */
    void send(String payload) throws IOException;

    /**
     * @return {@code true} while the underlying connection can still carry messages
     */
    boolean isOpen();

    /**
     * Closes the underlying connection. Closing an already closed transport is a no-op.
     */
    void close() throws IOException;
}
