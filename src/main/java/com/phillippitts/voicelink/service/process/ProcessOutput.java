package com.phillippitts.voicelink.service.process;

/**
 * Captured result of a finished process.
 *
 * @param stdout standard output (possibly truncated at the configured cap)
 * @param stderr standard error (capped)
 * @param exitCode exit status
 * @param durationMs wall-clock run time
 */
public record ProcessOutput(String stdout, String stderr, int exitCode, long durationMs) {
}
