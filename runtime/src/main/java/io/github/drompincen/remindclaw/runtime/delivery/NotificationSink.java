package io.github.drompincen.remindclaw.runtime.delivery;

/**
 * The transport that actually delivers reminder text. Called only from the
 * {@link DeliveryLoop} thread; it may drop text for a destination it no longer knows.
 */
public interface NotificationSink {

    void send(String destination, String text) throws Exception;
}
