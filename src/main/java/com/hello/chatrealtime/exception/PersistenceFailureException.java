package com.hello.chatrealtime.exception;

/**
 * A call into the persistence collaborator failed. Side-effect handlers log it
 * and drop the event.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
