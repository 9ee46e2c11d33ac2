package com.phantomrelay.protocol;

/**
 * Acknowledgment to the sender. {@code status} is {@code delivered} when at
 * least one open session of the recipient took the message, {@code queued}
 * otherwise.
 */
public record MessageSentFrame(String type, String messageId, String status) implements OutboundFrame {

    public static final String TYPE = "messageSent";

    public MessageSentFrame(String messageId, String status) {
        this(TYPE, messageId, status);
    }
}
