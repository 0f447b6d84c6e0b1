package com.walkierelay.server.config;

import com.walkierelay.server.lifecycle.ProcessTerminator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // halt, not exit: this runs inside the JVM shutdown hook
    @Bean
    public ProcessTerminator processTerminator() {
        return status -> Runtime.getRuntime().halt(status);
    }
}
