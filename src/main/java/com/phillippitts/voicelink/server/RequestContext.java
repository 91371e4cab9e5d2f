package com.phillippitts.voicelink.server;

import java.time.Duration;

/**
 * Per-request facts handlers need besides the request itself.
 *
 * @param connectionId short id also present in the logging context
 * @param processingTimeout ceiling on the time a handler may wait for its result
 */
public record RequestContext(String connectionId, Duration processingTimeout) {
}
