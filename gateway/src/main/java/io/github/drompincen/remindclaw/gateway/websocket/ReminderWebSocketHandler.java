package io.github.drompincen.remindclaw.gateway.websocket;

import io.github.drompincen.remindclaw.protocol.ws.WsMessage;
import io.github.drompincen.remindclaw.protocol.ws.WsMessageType;
import io.github.drompincen.remindclaw.runtime.delivery.DeliveryLoop;
import io.github.drompincen.remindclaw.runtime.delivery.NotificationBridge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Chat side of the WebSocket transport. A client sends {@code BIND_DESTINATION} to become the
 * place reminders are delivered to; the most recent binder wins.
 */
@Component
public class ReminderWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ReminderWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final WebSocketNotificationSink sink;
    private final NotificationBridge bridge;
    private final DeliveryLoop deliveryLoop;

    public ReminderWebSocketHandler(ObjectMapper objectMapper, WebSocketNotificationSink sink,
                                    NotificationBridge bridge, DeliveryLoop deliveryLoop) {
        this.objectMapper = objectMapper;
        this.sink = sink;
        this.bridge = bridge;
        this.deliveryLoop = deliveryLoop;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sink.register(session);
        log.debug("WebSocket {} connected", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sink.unregister(session.getId());
        bridge.unbindIfCurrent(session.getId());
        log.debug("WebSocket {} closed: {}", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        String id = session.getId();
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sink.push(id, error(id, "Malformed message"));
            return;
        }

        String type = node.path("type").asText();
        if (WsMessageType.BIND_DESTINATION.name().equals(type)) {
            bridge.bindDestination(id, deliveryLoop);
            sink.push(id, WsMessage.of(WsMessageType.BOUND, id, null));
        } else if (WsMessageType.UNBIND_DESTINATION.name().equals(type)) {
            bridge.unbindIfCurrent(id);
            sink.push(id, WsMessage.of(WsMessageType.UNBOUND, id, null));
        } else {
            sink.push(id, error(id, "Unknown message type: " + type));
        }
    }

    private WsMessage error(String destination, String text) {
        return WsMessage.error(destination, objectMapper.createObjectNode().put("error", text));
    }
}
