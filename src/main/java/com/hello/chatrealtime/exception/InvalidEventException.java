package com.hello.chatrealtime.exception;

/**
 * Inbound event that cannot be processed as sent: malformed envelope, missing
 * ids, or values outside the allowed set.
 */
public class InvalidEventException extends ClientEventException {

    public InvalidEventException(String message) {
        super(message);
    }
}
