package com.phantomrelay.protocol;

/** A recognized frame is missing a required field. */
public class ValidationException extends RelayException {

    public ValidationException(String message) {
        super(message);
    }
}
