package com.phantomrelay.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.phantomrelay.protocol.NewMessageFrame;

/**
 * A message waiting for its recipient to come online.
 * {@code timestamp} is epoch millis at the moment the sender's request was routed.
 */
public record QueuedMessage(String id, String from, JsonNode encryptedPayload, long timestamp) {

    public static QueuedMessage of(NewMessageFrame frame) {
        return new QueuedMessage(frame.id(), frame.from(), frame.encryptedMessage(), frame.timestamp());
    }

    public NewMessageFrame toFrame() {
        return new NewMessageFrame(from, encryptedPayload, timestamp, id);
    }
}
