package com.phantomrelay.protocol;

/**
 * Base for failures that are reported back to the originating client as an
 * {@code error} frame. The message is the text the client sees.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
