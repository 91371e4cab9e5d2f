package com.phillippitts.voicelink.service.postprocess;

import com.phillippitts.voicelink.exception.EnhancementException;

/**
 * Optional AI rewrite of a finished transcript.
 *
 * <p>Failures are non-fatal to callers: the transcription response reports {@code enhanced:false}.
 */
public interface EnhancementService {

    /**
     * @return true when enough configuration exists to attempt {@link #enhance(String)}
     */
    boolean isConfigured();

    /**
     * Rewrites the transcript.
     *
     * @throws EnhancementException on any provider failure
     */
    String enhance(String text);
}
