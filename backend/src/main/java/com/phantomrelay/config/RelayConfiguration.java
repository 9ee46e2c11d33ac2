package com.phantomrelay.config;

import java.time.Clock;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phantomrelay.protocol.FrameCodec;
import com.phantomrelay.relay.RelayServer;
import com.phantomrelay.relay.RelayWebSocketHandler;

import reactor.core.scheduler.Schedulers;

@Configuration
public class RelayConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public RelayServer relayServer(RelayProperties properties, FrameCodec frameCodec, Clock clock) {
        return new RelayServer(properties, frameCodec, clock, Schedulers.parallel());
    }

    @Bean
    public RelayWebSocketHandler relayWebSocketHandler(RelayServer relayServer, FrameCodec frameCodec) {
        return new RelayWebSocketHandler(relayServer, frameCodec);
    }

    /** Runs ahead of annotated controllers so the relay path is always the WebSocket endpoint. */
    @Bean
    public HandlerMapping relayHandlerMapping(RelayProperties properties, RelayWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(properties.path(), handler), Ordered.HIGHEST_PRECEDENCE);
    }
}
