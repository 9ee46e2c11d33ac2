package com.phantomrelay.relay;

import com.phantomrelay.protocol.ConnectionHandle;

/**
 * Per-connection context. Remembers which account the connection was last
 * successfully registered under, so a close can be resolved without asking
 * the handle.
 */
public class RelaySession {

    private final ConnectionHandle connection;
    private volatile String accountId;

    public RelaySession(ConnectionHandle connection) {
        this.connection = connection;
    }

    public ConnectionHandle connection() {
        return connection;
    }

    /** The bound account id, or {@code null} before the first successful registration. */
    public String accountId() {
        return accountId;
    }

    void bind(String accountId) {
        this.accountId = accountId;
    }
}
