package com.phillippitts.voicelink.service.session;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.domain.InboundMessage;
import com.phillippitts.voicelink.domain.MessageType;
import com.phillippitts.voicelink.exception.DuplicateConnectionException;
import com.phillippitts.voicelink.exception.MessageDecodeException;
import com.phillippitts.voicelink.exception.MessageDispatchException;
import com.phillippitts.voicelink.service.connection.ConnectionIdGenerator;
import com.phillippitts.voicelink.service.connection.ConnectionRecord;
import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import com.phillippitts.voicelink.service.dispatch.MessageDispatcher;
import com.phillippitts.voicelink.service.dispatch.MessageEnvelopeDecoder;
import com.phillippitts.voicelink.service.metrics.ConnectionMetrics;
import com.phillippitts.voicelink.service.transport.MessageTransport;
import com.phillippitts.voicelink.service.transport.SafeMessageSender;
import com.phillippitts.voicelink.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives one connection from accept to cleanup on the calling thread.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CONNECTING → REGISTERED   id generated, record added, system_ready sent
 * REGISTERED → RECEIVING    welcome written
 * RECEIVING  → RESPONDING   frame received and counted
 * RESPONDING → RECEIVING    response (or error reply) written
 * any        → CLOSED       EOF, receive failure, send failure or unexpected error
 * </pre>
 *
 * <p>Malformed frames and failures while answering a decoded message are answered with an
 * {@code error} message and the connection stays open; only a failed send or receive ends it.
 * The registry entry is removed in a {@code finally} block, so it is dropped exactly once on
 * every exit path.
 *
 * <p><b>Thread Safety:</b> the bean is stateless and shared; all per-connection state lives on
 * the stack of the thread running {@link #run(MessageTransport)}. That thread blocks in
 * {@link MessageTransport#receive()} with no timeout, so a silent client holds its thread until
 * it disconnects.
 *
 * @since 1.0
 */
@Component
public class ConnectionHandlerLoop {

    private static final Logger LOG = LogManager.getLogger(ConnectionHandlerLoop.class);

    static final String MDC_CONNECTION_ID = "connectionId";
    private static final int LOG_PREVIEW_CHARS = 120;
    private static final List<String> EXPECTED_CLOSE_MARKERS = List.of("closed", "broken", "reset", "aborted");

    private final ConnectionRegistry registry;
    private final ConnectionIdGenerator idGenerator;
    private final MessageEnvelopeDecoder decoder;
    private final MessageDispatcher dispatcher;
    private final SafeMessageSender sender;
    private final ConnectionMetrics metrics;
    private final Clock clock;

    public ConnectionHandlerLoop(ConnectionRegistry registry,
                                 ConnectionIdGenerator idGenerator,
                                 MessageEnvelopeDecoder decoder,
                                 MessageDispatcher dispatcher,
                                 SafeMessageSender sender,
                                 ConnectionMetrics metrics,
                                 Clock clock) {
        this.registry = registry;
        this.idGenerator = idGenerator;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.sender = sender;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the connection until it closes. Never throws; the transport is closed on return.
     *
     * @param transport freshly accepted connection, owned by this call from now on
     * @return why the connection ended
     */
    public CloseReason run(MessageTransport transport) {
        String id = idGenerator.nextId();
        ThreadContext.put(MDC_CONNECTION_ID, id);
        LOG.info("New connection: {}", id);
        enter(id, ConnectionState.CONNECTING);

        CloseReason reason = CloseReason.ERROR;
        boolean registered = false;
        try {
            registry.add(id, new ConnectionRecord(id, transport, clock.instant()));
            registered = true;
            metrics.incrementOpened();
            enter(id, ConnectionState.REGISTERED);

            if (!sender.send(id, transport, dispatcher.welcome(id))) {
                LOG.error("Failed to send welcome message to {}", id);
                reason = CloseReason.WELCOME_FAILED;
                return reason;
            }
            LOG.info("Welcome sent to {}", id);
            enter(id, ConnectionState.RECEIVING);

            reason = receiveLoop(id, transport);
            return reason;
        } catch (DuplicateConnectionException e) {
            LOG.error("Refusing connection: {}", e.getMessage());
            reason = CloseReason.REJECTED;
            return reason;
        } catch (RuntimeException e) {
            LOG.error("Handler error for {}: {}", id, e.toString());
            LOG.debug("Handler error stack trace for {}", id, e);
            reason = CloseReason.ERROR;
            return reason;
        } finally {
            enter(id, ConnectionState.CLOSED);
            if (registered) {
                registry.remove(id);
            }
            closeQuietly(id, transport);
            metrics.incrementClosed(reason);
            LOG.info("Cleanup completed for {} ({})", id, reason);
            ThreadContext.remove(MDC_CONNECTION_ID);
        }
    }

    private CloseReason receiveLoop(String id, MessageTransport transport) {
        while (true) {
            String raw;
            try {
                raw = transport.receive();
            } catch (IOException e) {
                if (isExpectedClosure(e)) {
                    LOG.info("Connection {} closed unexpectedly: {}", id, e.getMessage());
                } else {
                    LOG.error("Receive error for {}: {}", id, e.toString());
                    LOG.debug("Receive error stack trace for {}", id, e);
                }
                return CloseReason.ABRUPT;
            }
            if (raw == null) {
                LOG.info("Connection {} closed by client (clean)", id);
                return CloseReason.CLEAN;
            }

            enter(id, ConnectionState.RESPONDING);
            Optional<ConnectionSnapshot> stats = registry.touch(id);
            if (!respond(id, transport, raw, stats)) {
                return CloseReason.SEND_FAILED;
            }
            enter(id, ConnectionState.RECEIVING);
        }
    }

    /**
     * Answers one received frame.
     *
     * @return {@code false} if the reply could not be written
     */
    private boolean respond(String id, MessageTransport transport, String raw, Optional<ConnectionSnapshot> stats) {
        InboundMessage message;
        try {
            message = decoder.decode(raw);
        } catch (MessageDecodeException e) {
            LOG.warn("Invalid JSON from {}: {} (frame: {})",
                    id, e.getDetail(), LogSanitizer.preview(raw, LOG_PREVIEW_CHARS));
            metrics.incrementInvalid();
            return sender.send(id, transport, dispatcher.invalidJson(e.getDetail()));
        }

        metrics.incrementReceived(message.type());
        JSONObject response;
        try {
            ConnectionSnapshot connection = stats.orElseThrow(() -> new MessageDispatchException(
                    "Connection " + id + " is no longer registered", message.rawType()));
            if (message.type() == MessageType.HEARTBEAT) {
                LOG.debug("Heartbeat from {}", id);
            } else {
                LOG.info("{}: {}", id, LogSanitizer.truncate(message.rawType(), LOG_PREVIEW_CHARS));
            }
            response = dispatcher.dispatch(message, connection);
        } catch (RuntimeException e) {
            LOG.error("Message processing error for {}: {}", id, e.getMessage());
            LOG.debug("Message processing stack trace for {}", id, e);
            return sender.send(id, transport, dispatcher.processingError());
        }

        if (!sender.send(id, transport, response)) {
            LOG.error("Failed to send response to {}", id);
            return false;
        }
        if (message.type() == MessageType.PING) {
            LOG.debug("Pong sent to {}", id);
        } else if (message.type() != MessageType.HEARTBEAT) {
            LOG.info("Response sent to {}: {}", id, response.optString("type"));
        }
        return true;
    }

    /**
     * Classifies a receive failure as an ordinary disconnect rather than a server-side fault.
     * Only affects the log level; both end the connection the same way.
     */
    static boolean isExpectedClosure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof EOFException || t instanceof ClosedChannelException) {
                return true;
            }
            String text = t.getMessage();
            if (text != null) {
                String lower = text.toLowerCase(Locale.ROOT);
                for (String marker : EXPECTED_CLOSE_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static void enter(String id, ConnectionState state) {
        LOG.trace("{} -> {}", id, state);
    }

    private static void closeQuietly(String id, MessageTransport transport) {
        try {
            transport.close();
        } catch (IOException | RuntimeException e) {
            LOG.debug("Error closing transport for {}: {}", id, e.toString());
        }
    }
}
