package com.phillippitts.voicelink.service.transcription;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicelink.service.diarization.DiarizationMethod;

/**
 * {@code metadata} object of a transcription response. All times are in seconds.
 *
 * @param model display name of the model used
 * @param duration audio duration
 * @param processingTime time from request dispatch to response
 * @param transcriptionTime time spent in the engine
 * @param diarizationTime time spent diarizing and aligning, null when not diarized
 * @param enhancementTime time spent enhancing, null when not enhanced
 * @param diarizationEnabled null when diarization was not requested
 * @param diarizationError failure message when diarization failed and the plain transcript was kept
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionMetadata(String model, String language, double duration, double processingTime,
                                    double transcriptionTime, Double diarizationTime, Double enhancementTime,
                                    boolean enhanced, Boolean diarizationEnabled,
                                    DiarizationMethod diarizationMethod, boolean replacementsApplied,
                                    String diarizationError) {
}
