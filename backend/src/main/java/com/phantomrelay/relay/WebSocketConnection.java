package com.phantomrelay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.phantomrelay.protocol.ConnectionHandle;
import com.phantomrelay.protocol.FrameCodec;
import com.phantomrelay.protocol.OutboundFrame;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link ConnectionHandle} over a WebFlux {@link WebSocketSession}.
 *
 * Frames go into a buffered unicast sink that the session's single outbound
 * subscription drains, so {@link #send} never blocks. Emission is serialized
 * on this object because frames for one session can come from any thread
 * routing to its account.
 */
class WebSocketConnection implements ConnectionHandle {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession session;
    private final FrameCodec codec;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

    private volatile boolean completed;

    WebSocketConnection(WebSocketSession session, FrameCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !completed && session.isOpen();
    }

    @Override
    public synchronized boolean send(OutboundFrame frame) {
        if (!isOpen()) {
            return false;
        }
        String text;
        try {
            text = codec.encode(frame);
        } catch (JsonProcessingException e) {
            logger.warn("Could not encode {} frame for {}", frame.type(), id(), e);
            return false;
        }
        return outbound.tryEmitNext(text).isSuccess();
    }

    @Override
    public void close() {
        complete();
        session.close(CloseStatus.GOING_AWAY)
                .subscribe(null, error -> logger.debug("Close of {} failed", id(), error));
    }

    Flux<String> frames() {
        return outbound.asFlux();
    }

    /** Ends the outbound stream once everything already emitted has been written. */
    synchronized void complete() {
        if (!completed) {
            completed = true;
            outbound.tryEmitComplete();
        }
    }
}
