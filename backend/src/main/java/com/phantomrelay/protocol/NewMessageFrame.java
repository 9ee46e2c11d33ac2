package com.phantomrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A relayed message as the recipient sees it.
 * {@code encryptedMessage} is forwarded exactly as the sender supplied it.
 */
public record NewMessageFrame(String type, String from, JsonNode encryptedMessage, long timestamp, String id)
        implements OutboundFrame {

    public static final String TYPE = "newMessage";

    public NewMessageFrame(String from, JsonNode encryptedMessage, long timestamp, String id) {
        this(TYPE, from, encryptedMessage, timestamp, id);
    }
}
