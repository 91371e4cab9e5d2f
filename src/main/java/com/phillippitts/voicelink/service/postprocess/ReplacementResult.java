package com.phillippitts.voicelink.service.postprocess;

/**
 * Output of {@link WordReplacementService#apply(String)}.
 *
 * @param text text after replacement
 * @param changed true when at least one rule matched
 */
public record ReplacementResult(String text, boolean changed) {
}
