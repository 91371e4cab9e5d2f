package com.phillippitts.voicelink.server;

/**
 * Lifecycle of one accepted connection. Transitions only move forward.
 */
public enum ConnectionState {
    READING_HEADERS,
    READING_BODY,
    DISPATCHED,
    RESPONDING,
    CLOSED
}
