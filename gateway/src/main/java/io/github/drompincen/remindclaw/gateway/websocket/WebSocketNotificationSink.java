package io.github.drompincen.remindclaw.gateway.websocket;

import io.github.drompincen.remindclaw.protocol.ws.WsMessage;
import io.github.drompincen.remindclaw.protocol.ws.WsMessageType;
import io.github.drompincen.remindclaw.runtime.delivery.NotificationSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat transport over WebSocket. Destinations are WebSocket session ids; every session is
 * wrapped so that replies from the handler thread and reminders from the delivery loop
 * never write to the socket at the same time.
 */
@Component
public class WebSocketNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebSocketNotificationSink.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketNotificationSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(String sessionId) {
        sessions.remove(sessionId);
    }

    public boolean isConnected(String sessionId) {
        WebSocketSession session = sessions.get(sessionId);
        return session != null && session.isOpen();
    }

    @Override
    public void send(String destination, String text) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode().put("text", text);
        if (!push(destination, WsMessage.of(WsMessageType.REMINDER, destination, payload))) {
            log.warn("Destination {} is not connected, dropping reminder", destination);
        }
    }

    /** @return {@code false} if the destination has no open session */
    boolean push(String destination, WsMessage message) throws IOException {
        WebSocketSession session = sessions.get(destination);
        if (session == null || !session.isOpen()) return false;
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        return true;
    }
}
