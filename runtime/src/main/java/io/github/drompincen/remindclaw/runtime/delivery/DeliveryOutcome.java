package io.github.drompincen.remindclaw.runtime.delivery;

public enum DeliveryOutcome {
    /** Handed off to the delivery loop; the send itself happens later. */
    DELIVERED,
    NO_DESTINATION,
    LOOP_UNAVAILABLE
}
