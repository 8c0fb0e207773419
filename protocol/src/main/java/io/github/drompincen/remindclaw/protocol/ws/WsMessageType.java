package io.github.drompincen.remindclaw.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    BIND_DESTINATION,
    UNBIND_DESTINATION,

    // Server -> Client
    BOUND,
    UNBOUND,
    REMINDER,
    ERROR
}
