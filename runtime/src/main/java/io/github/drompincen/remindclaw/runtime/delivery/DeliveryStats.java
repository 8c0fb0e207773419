package io.github.drompincen.remindclaw.runtime.delivery;

import java.util.concurrent.atomic.AtomicLong;

/** Counters kept by {@link NotificationBridge}. */
public class DeliveryStats {

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong handedOff = new AtomicLong();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile String lastError;

    void recordAttempt() {
        attempts.incrementAndGet();
    }

    void recordHandoff() {
        handedOff.incrementAndGet();
    }

    void recordSent() {
        sent.incrementAndGet();
    }

    void recordFailure(String error) {
        failures.incrementAndGet();
        lastError = error;
    }

    public long attempts() {
        return attempts.get();
    }

    public long handedOff() {
        return handedOff.get();
    }

    public long sent() {
        return sent.get();
    }

    public long failures() {
        return failures.get();
    }

    public String lastError() {
        return lastError;
    }
}
