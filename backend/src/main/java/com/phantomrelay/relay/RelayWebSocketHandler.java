package com.phantomrelay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.phantomrelay.protocol.FrameCodec;

import reactor.core.publisher.Mono;

/**
 * Binds a WebSocket session to the relay: inbound text frames are handled one
 * at a time in arrival order, outbound frames are drained from the
 * connection's sink, and the session is detached from its account once either
 * side ends.
 */
public class RelayWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final RelayServer relayServer;
    private final FrameCodec codec;

    public RelayWebSocketHandler(RelayServer relayServer, FrameCodec codec) {
        this.relayServer = relayServer;
        this.codec = codec;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketConnection connection = new WebSocketConnection(session, codec);
        RelaySession relaySession = relayServer.open(connection);

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> relayServer.onFrame(relaySession, text))
                .onErrorResume(error -> {
                    logger.warn("WebSocket error on {}", session.getId(), error);
                    return Mono.empty();
                })
                .then()
                // runs before onClose below, so a registration still in flight finds the handle closed
                .doFinally(signal -> connection.complete());

        Mono<Void> outbound = session.send(connection.frames().map(session::textMessage));

        return Mono.when(inbound, outbound)
                .doFinally(signal -> relayServer.onClose(relaySession)
                        .subscribe(null, error -> logger.warn("Disconnect cleanup failed for {}",
                                session.getId(), error)));
    }
}
