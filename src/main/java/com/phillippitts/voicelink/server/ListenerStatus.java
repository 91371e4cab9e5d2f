package com.phillippitts.voicelink.server;

import com.phillippitts.voicelink.service.health.ApiStatus;
import org.springframework.stereotype.Component;

/**
 * Live listener facts published by {@link HttpConnectionListener} and read by the health endpoint.
 */
@Component
public class ListenerStatus {

    private volatile boolean running;
    private volatile int port;
    private volatile String endpoint = "";
    private volatile long startedNanos;

    void markStarted(int boundPort, String boundEndpoint) {
        this.port = boundPort;
        this.endpoint = boundEndpoint;
        this.startedNanos = System.nanoTime();
        this.running = true;
    }

    void markStopped() {
        this.running = false;
    }

    public ApiStatus current() {
        double uptime = running ? (System.nanoTime() - startedNanos) / 1_000_000_000.0 : 0.0;
        return new ApiStatus(endpoint, port, running, uptime);
    }
}
