package com.phillippitts.voicelink.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and thread management.
 *
 * <p>Used by {@link com.phillippitts.voicelink.service.process.ExternalProcessRunner} for
 * whisper.cpp, ffmpeg and ffprobe, and by the API listener during shutdown.
 */
public final class ProcessTimeouts {

    /**
     * Time for stream gobbler threads to flush buffered output after process exit.
     * 500ms is plenty for typical stdout/stderr volumes (&lt;100KB).
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Join timeout for the accept-loop thread when the listener stops. */
    public static final Duration ACCEPT_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
