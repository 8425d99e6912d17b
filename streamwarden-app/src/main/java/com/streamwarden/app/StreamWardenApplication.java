package com.streamwarden.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * StreamWarden application entry point.
 */
@SpringBootApplication
public class StreamWardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamWardenApplication.class, args);
    }
}
