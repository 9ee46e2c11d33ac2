package com.phantomrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to a key lookup. Only the public key and display name ever leave the
 * relay; it holds nothing else about an account.
 */
public record PublicKeyFrame(String type, String accountId, JsonNode publicKey, String username)
        implements OutboundFrame {

    public static final String TYPE = "publicKey";

    public PublicKeyFrame(String accountId, JsonNode publicKey, String username) {
        this(TYPE, accountId, publicKey, username);
    }
}
