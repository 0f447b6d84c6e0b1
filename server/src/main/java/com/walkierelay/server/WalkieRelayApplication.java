package com.walkierelay.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalkieRelayApplication {
    private static final Logger log = LoggerFactory.getLogger(WalkieRelayApplication.class);

    public static void main(String[] args) {
        // a fault on any thread is logged; the process keeps serving
        Thread.setDefaultUncaughtExceptionHandler((thread, error) ->
                log.error("[ERROR] uncaught exception on {}", thread.getName(), error));
        SpringApplication.run(WalkieRelayApplication.class, args);
    }
}
