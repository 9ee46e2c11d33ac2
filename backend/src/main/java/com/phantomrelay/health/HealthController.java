package com.phantomrelay.health;

import java.time.Clock;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.phantomrelay.relay.RelayServer;

import reactor.core.publisher.Mono;

/**
 * Read-only health endpoint for load balancers and uptime checks.
 */
@RestController
public class HealthController {

    private final RelayServer relayServer;
    private final Clock clock;

    public HealthController(RelayServer relayServer, Clock clock) {
        this.relayServer = relayServer;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return Mono.fromSupplier(() -> new HealthResponse(
                "ok",
                relayServer.accountDirectory().size(),
                clock.millis()));
    }
}
