package io.github.drompincen.remindclaw.gateway.config;

import io.github.drompincen.remindclaw.runtime.delivery.DeliveryLoop;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReminderConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** The loop that owns the chat transport; reminders are sent from this thread only. */
    @Bean(initMethod = "start", destroyMethod = "stop")
    DeliveryLoop deliveryLoop(@Value("${remindclaw.delivery.thread-name:delivery-loop}") String threadName) {
        return new DeliveryLoop(threadName);
    }
}
