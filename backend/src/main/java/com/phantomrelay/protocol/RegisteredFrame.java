package com.phantomrelay.protocol;

public record RegisteredFrame(String type, String accountId, int onlineUsers) implements OutboundFrame {

    public static final String TYPE = "registered";

    public RegisteredFrame(String accountId, int onlineUsers) {
        this(TYPE, accountId, onlineUsers);
    }
}
