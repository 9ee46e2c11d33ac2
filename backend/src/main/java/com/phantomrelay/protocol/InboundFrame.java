package com.phantomrelay.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The flat inbound envelope. Which fields matter depends on {@code type}:
 * <ul>
 *   <li>{@code register}: accountId, publicKey, username (optional)</li>
 *   <li>{@code sendMessage}: to, from, encryptedMessage</li>
 *   <li>{@code getPublicKey}: accountId</li>
 *   <li>{@code ping}: nothing</li>
 * </ul>
 * {@code publicKey} and {@code encryptedMessage} stay as raw JSON: the relay
 * never looks inside them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundFrame(
        String type,
        String accountId,
        JsonNode publicKey,
        String username,
        String to,
        String from,
        JsonNode encryptedMessage
) {

    public static final String REGISTER = "register";
    public static final String SEND_MESSAGE = "sendMessage";
    public static final String GET_PUBLIC_KEY = "getPublicKey";
    public static final String PING = "ping";
}
