package com.phantomrelay.protocol;

/**
 * Marker for every frame the relay writes to a client.
 * Each implementation carries its own {@code type} discriminator.
 */
public interface OutboundFrame {

    String type();
}
