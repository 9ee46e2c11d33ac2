package com.phantomrelay.protocol;

public record ErrorFrame(String type, String message) implements OutboundFrame {

    public static final String TYPE = "error";

    public ErrorFrame(String message) {
        this(TYPE, message);
    }
}
