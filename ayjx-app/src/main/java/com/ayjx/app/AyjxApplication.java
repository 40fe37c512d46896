package com.ayjx.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bot entry point.
 */
@SpringBootApplication
public class AyjxApplication {

    public static void main(String[] args) {
        SpringApplication.run(AyjxApplication.class, args);
    }
}
