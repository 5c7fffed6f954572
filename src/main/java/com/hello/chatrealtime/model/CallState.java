package com.hello.chatrealtime.model;

/**
 * Signaling state of a call. Only RINGING and ACCEPTED sessions are ever stored;
 * the other states are terminal and reported in logs when a session is destroyed.
 */
public enum CallState {
    RINGING,
    ACCEPTED,
    REJECTED,
    FAILED,
    ENDED
}
