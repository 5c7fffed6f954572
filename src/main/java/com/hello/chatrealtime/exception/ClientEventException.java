package com.hello.chatrealtime.exception;

/**
 * Failure the client can act on. The dispatcher turns it into an {@code error}
 * event carrying {@link #getMessage()}.
 */
public class ClientEventException extends RuntimeException {

    public ClientEventException(String message) {
        super(message);
    }
}
