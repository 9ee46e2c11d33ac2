package com.phantomrelay.protocol;

public class MalformedFrameException extends RelayException {

    public static final String MESSAGE = "Invalid message format";

    public MalformedFrameException(Throwable cause) {
        super(MESSAGE, cause);
    }

    public MalformedFrameException() {
        super(MESSAGE);
    }
}
