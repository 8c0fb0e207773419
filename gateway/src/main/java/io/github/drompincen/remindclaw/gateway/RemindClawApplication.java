package io.github.drompincen.remindclaw.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.remindclaw")
public class RemindClawApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemindClawApplication.class, args);
    }
}
