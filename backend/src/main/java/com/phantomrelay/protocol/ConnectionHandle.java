package com.phantomrelay.protocol;

/**
 * An opaque reference to one live transport session.
 *
 * The relay never asks a handle which account it belongs to; that binding is
 * kept by the session context that owns the handle.
 */
public interface ConnectionHandle {

    /** Transport-level identifier, used only for logging. */
    String id();

    /**
     * False once the transport has closed, even if the handle has not yet been
     * removed from its account.
     */
    boolean isOpen();

    /**
     * Hands a frame to the transport. Returns {@code false} when the frame could
     * not be queued for writing (closed session, encoding failure).
     */
    boolean send(OutboundFrame frame);

    /** Closes the underlying session. Safe to call more than once. */
    void close();
}
