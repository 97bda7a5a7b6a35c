package com.phillippitts.voicelink.presentation.websocket;

import com.phillippitts.voicelink.service.session.ConnectionHandlerLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * WebSocket entry point: starts one {@link ConnectionHandlerLoop} per accepted session on the
 * connection executor and feeds it the session's frames.
 *
 * <p>Container callbacks never block; they only hand frames and close signals to the
 * session's {@link WebSocketSessionTransport}. When the executor has no thread left for a new
 * connection, the session is closed with status 1013 (try again later) before it is registered.
 */
@Component
public class VoiceLinkWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(VoiceLinkWebSocketHandler.class);

    static final String TRANSPORT_ATTRIBUTE = WebSocketSessionTransport.class.getName();

    private final ConnectionHandlerLoop handlerLoop;
    private final Executor connectionExecutor;

    public VoiceLinkWebSocketHandler(ConnectionHandlerLoop handlerLoop,
                                     @Qualifier("connectionExecutor") Executor connectionExecutor) {
        this.handlerLoop = handlerLoop;
        this.connectionExecutor = connectionExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        WebSocketSessionTransport transport = new WebSocketSessionTransport(session);
        session.getAttributes().put(TRANSPORT_ATTRIBUTE, transport);
        try {
            connectionExecutor.execute(() -> handlerLoop.run(transport));
        } catch (RejectedExecutionException e) {
            LOG.warn("No handler thread available for session {} from {}; closing",
                    session.getId(), session.getRemoteAddress());
            session.getAttributes().remove(TRANSPORT_ATTRIBUTE);
            session.close(CloseStatus.SERVICE_OVERLOAD);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.deliver(message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.failed(exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.closed(status);
        }
    }

    private static WebSocketSessionTransport transportOf(WebSocketSession session) {
        Object attribute = session.getAttributes().get(TRANSPORT_ATTRIBUTE);
        return attribute instanceof WebSocketSessionTransport t ? t : null;
    }
}
