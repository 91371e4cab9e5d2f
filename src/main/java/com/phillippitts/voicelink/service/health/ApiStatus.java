package com.phillippitts.voicelink.service.health;

/**
 * Listener facts reported by the health endpoint.
 *
 * @param endpoint base URL clients use, e.g. {@code http://localhost:5000}
 * @param uptimeSeconds seconds since the listener started
 */
public record ApiStatus(String endpoint, int port, boolean running, double uptimeSeconds) {
}
