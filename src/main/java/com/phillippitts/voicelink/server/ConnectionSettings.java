package com.phillippitts.voicelink.server;

import java.time.Duration;

/**
 * Limits applied by a connection handler.
 *
 * @param readChunkBytes size of each socket read
 * @param inactivityTimeout socket read timeout; a read that makes progress resets it
 * @param processingTimeout ceiling on waiting for the handler result
 * @param heartbeatInterval period of {@code 102 Processing} interim responses, null to disable
 */
public record ConnectionSettings(int readChunkBytes, long maxBodyBytes, int maxHeaderBytes,
                                 Duration inactivityTimeout, Duration processingTimeout,
                                 Duration heartbeatInterval) {
}
