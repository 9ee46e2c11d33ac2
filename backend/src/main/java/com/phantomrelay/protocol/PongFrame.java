package com.phantomrelay.protocol;

public record PongFrame(String type) implements OutboundFrame {

    public static final String TYPE = "pong";

    public PongFrame() {
        this(TYPE);
    }
}
