package com.phantomrelay.account;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.phantomrelay.protocol.ConnectionHandle;

/**
 * A relay account. The server keeps only the public half of the client's key
 * material, as an opaque value; it cannot use it and never checks that the
 * registering party holds the matching private key.
 *
 * <p>{@code publicKey} and {@code username} are pinned by the first
 * registration. Only the connection set changes afterwards.
 */
public class Account {

    private final String id;
    private final JsonNode publicKey;
    private final String username;
    private final long registeredAt;
    private final Set<ConnectionHandle> connections = ConcurrentHashMap.newKeySet();

    public Account(String id, JsonNode publicKey, String username, long registeredAt) {
        this.id = id;
        this.publicKey = publicKey;
        this.username = username;
        this.registeredAt = registeredAt;
    }

    public String id() { return id; }
    public JsonNode publicKey() { return publicKey; }
    public String username() { return username; }
    public long registeredAt() { return registeredAt; }

    boolean addConnection(ConnectionHandle connection) {
        return connections.add(connection);
    }

    boolean removeConnection(ConnectionHandle connection) {
        return connections.remove(connection);
    }

    public int connectionCount() {
        return connections.size();
    }

    public boolean hasConnection(ConnectionHandle connection) {
        return connections.contains(connection);
    }

    /** Handles whose transport is still open. Closed, not yet removed handles are skipped. */
    public List<ConnectionHandle> openConnections() {
        return connections.stream()
                .filter(ConnectionHandle::isOpen)
                .toList();
    }

    public boolean isOnline() {
        return connections.stream().anyMatch(ConnectionHandle::isOpen);
    }
}
