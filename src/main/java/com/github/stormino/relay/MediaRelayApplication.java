package com.github.stormino.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
public class MediaRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaRelayApplication.class, args);
    }
}
