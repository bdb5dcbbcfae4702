package com.example.screenrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScreenRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScreenRelayApplication.class, args);
    }
}
