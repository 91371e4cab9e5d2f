package com.phillippitts.voicelink.exception;

/**
 * Thrown when the API listener cannot bind its port (occupied, or access denied).
 */
public class ServerBindException extends VoiceLinkException {

    private final int port;

    public ServerBindException(int port, Throwable cause) {
        super("Failed to bind API server to port " + port + ": " + cause.getMessage(), cause);
        this.port = port;
    }

    public int getPort() {
        return port;
    }
}
