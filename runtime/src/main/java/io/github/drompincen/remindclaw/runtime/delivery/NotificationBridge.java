package io.github.drompincen.remindclaw.runtime.delivery;

import io.github.drompincen.remindclaw.protocol.api.DeliveryStatsDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Moves "deliver this text" requests from the reminder engine thread onto the
 * {@link DeliveryLoop} that owns the {@link NotificationSink}. {@link #deliver(String)} never
 * blocks on the send and never throws; failures are logged and counted in {@link #stats()}.
 */
@Component
public class NotificationBridge {

    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    private final NotificationSink sink;
    private final AtomicReference<Binding> binding = new AtomicReference<>();
    private final DeliveryStats stats = new DeliveryStats();

    record Binding(String destination, DeliveryLoop loop) {}

    public NotificationBridge(NotificationSink sink) {
        this.sink = sink;
    }

    /** Sets where reminders go from the next fire on, replacing any earlier destination. */
    public void bindDestination(String destination, DeliveryLoop loop) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(loop, "loop");
        Binding previous = binding.getAndSet(new Binding(destination, loop));
        if (previous != null && !previous.destination().equals(destination)) {
            log.info("Reminder destination changed from {} to {}", previous.destination(), destination);
        } else {
            log.info("Reminder destination bound to {}", destination);
        }
    }

    public void unbind() {
        Binding previous = binding.getAndSet(null);
        if (previous != null) {
            log.info("Reminder destination {} unbound", previous.destination());
        }
    }

    /** Unbinds only if {@code destination} is still the bound one. */
    public boolean unbindIfCurrent(String destination) {
        Binding current = binding.get();
        if (current != null && current.destination().equals(destination)
                && binding.compareAndSet(current, null)) {
            log.info("Reminder destination {} unbound", destination);
            return true;
        }
        return false;
    }

    public boolean isReady() {
        return binding.get() != null;
    }

    public String destination() {
        Binding current = binding.get();
        return current != null ? current.destination() : null;
    }

    public DeliveryOutcome deliver(String text) {
        stats.recordAttempt();
        Binding target = binding.get();
        if (target == null) {
            stats.recordFailure("No delivery destination bound");
            log.error("No delivery destination bound, dropping reminder");
            return DeliveryOutcome.NO_DESTINATION;
        }
        Runnable lost = () -> {
            stats.recordFailure("Delivery loop stopped before sending");
            log.warn("Delivery loop {} stopped before sending reminder to {}",
                    target.loop().threadName(), target.destination());
        };
        if (!target.loop().submit(() -> send(target.destination(), text), lost)) {
            stats.recordFailure("Delivery loop not running");
            log.error("Delivery loop {} not available, dropping reminder for {}",
                    target.loop().threadName(), target.destination());
            return DeliveryOutcome.LOOP_UNAVAILABLE;
        }
        stats.recordHandoff();
        return DeliveryOutcome.DELIVERED;
    }

    public DeliveryStats stats() {
        return stats;
    }

    public DeliveryStatsDto describe() {
        return new DeliveryStatsDto(isReady(), destination(), stats.attempts(), stats.handedOff(),
                stats.sent(), stats.failures(), stats.lastError());
    }

    private void send(String destination, String text) {
        try {
            sink.send(destination, text);
            stats.recordSent();
        } catch (Exception e) {
            stats.recordFailure(e.getMessage());
            log.warn("Failed to send reminder to {}: {}", destination, e.getMessage());
        }
    }
}
