package io.github.drompincen.remindclaw.protocol.api;

public record DeliveryStatsDto(
        boolean ready,
        String destination,
        long attempts,
        long handedOff,
        long sent,
        long failures,
        String lastError
) {}
