package com.hello.chatrealtime.exception;

/**
 * Raised when a connection or request cannot be tied to a known user.
 * Terminates the WebSocket handshake before any session state exists.
 */
public class AuthFailureException extends RuntimeException {

    public enum Reason {
        MISSING_TOKEN("missing_token"),
        INVALID_TOKEN("invalid_token"),
        USER_NOT_FOUND("user_not_found");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Reason reason;

    public AuthFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
