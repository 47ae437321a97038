package com.phillippitts.talkback.presentation.websocket;

import com.phillippitts.talkback.config.properties.WebSocketProperties;
import com.phillippitts.talkback.exception.ProtocolException;
import com.phillippitts.talkback.service.session.InboundMessage;
import com.phillippitts.talkback.service.session.OutboundMessage;
import com.phillippitts.talkback.service.session.SessionMessageCodec;
import com.phillippitts.talkback.service.session.SessionSink;
import com.phillippitts.talkback.service.session.VoiceSession;
import com.phillippitts.talkback.service.session.VoiceSessionManager;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * WebSocket transport for voice sessions. Each connection maps to one {@link VoiceSession};
 * outbound messages are serialized through a {@link ConcurrentWebSocketSessionDecorator} since
 * turn workers send from their own threads.
 */
@Component
public class VoiceWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(VoiceWebSocketHandler.class);

    private final VoiceSessionManager sessionManager;
    private final SessionMessageCodec codec;
    private final WebSocketProperties properties;

    public VoiceWebSocketHandler(VoiceSessionManager sessionManager,
                                 SessionMessageCodec codec,
                                 WebSocketProperties properties) {
        this.sessionManager = sessionManager;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.setTextMessageSizeLimit(properties.getMaxTextMessageBytes());
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeBytes());
        sessionManager.open(session.getId(), new WebSocketSink(outbound, codec));
        LOG.info("WebSocket connected: session={}, remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ThreadContext.put("sessionId", session.getId());
        try {
            VoiceSession voiceSession = sessionManager.get(session.getId());
            if (voiceSession == null) {
                LOG.warn("Message for unknown session {} dropped", session.getId());
                return;
            }
            InboundMessage inbound = codec.decode(message.getPayload());
            voiceSession.handle(inbound);
        } catch (ProtocolException e) {
            LOG.warn("Malformed message dropped: {} (payload: {})", e.getMessage(),
                    LogSanitizer.truncate(message.getPayload(), 120));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("WebSocket transport error: session={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionManager.close(session.getId());
        LOG.info("WebSocket closed: session={}, status={}", session.getId(), status);
    }

    /**
     * Sink that writes encoded messages to a thread-safe session decorator.
     */
    static final class WebSocketSink implements SessionSink {

        private final WebSocketSession session;
        private final SessionMessageCodec codec;

        WebSocketSink(WebSocketSession session, SessionMessageCodec codec) {
            this.session = session;
            this.codec = codec;
        }

        @Override
        public boolean send(OutboundMessage message) {
            if (!session.isOpen()) {
                LOG.debug("Session {} closed; {} not sent", session.getId(), message.type());
                return false;
            }
            try {
                session.sendMessage(new TextMessage(codec.encode(message)));
                return true;
            } catch (IOException | IllegalStateException e) {
                LOG.warn("Send failed: session={}, type={}, error={}", session.getId(), message.type(),
                        e.getMessage());
                return false;
            }
        }
    }
}
