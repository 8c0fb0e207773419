package io.github.drompincen.remindclaw.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String destination,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String destination, JsonNode payload) {
        return new WsMessage(type, destination, payload, Instant.now());
    }

    public static WsMessage error(String destination, JsonNode payload) {
        return of(WsMessageType.ERROR, destination, payload);
    }
}
