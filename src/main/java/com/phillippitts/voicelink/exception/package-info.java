/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicelink.exception.VoiceLinkException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicelink.exception.InvalidAudioException} - Uploaded audio
 *       could not be decoded or normalized</li>
 *   <li>{@link com.phillippitts.voicelink.exception.ModelNotFoundException} - Selected model
 *       file is missing or unreadable</li>
 *   <li>{@link com.phillippitts.voicelink.exception.NoModelSelectedException} - No model has
 *       been selected yet</li>
 *   <li>{@link com.phillippitts.voicelink.exception.TranscriptionException} - A transcription
 *       provider or helper process failed</li>
 *   <li>{@link com.phillippitts.voicelink.exception.DiarizationException} - Speaker diarization
 *       failed or is not available</li>
 *   <li>{@link com.phillippitts.voicelink.exception.EnhancementException} - Text enhancement
 *       failed (never fatal for a request)</li>
 *   <li>{@link com.phillippitts.voicelink.exception.ServerBindException} - The API listener
 *       could not bind its port</li>
 * </ul>
 *
 * <p>HTTP mapping of failures lives in {@link com.phillippitts.voicelink.server.http.ApiErrorCode}.
 * Protocol errors never appear here; the connection handler answers them directly.
 */
package com.phillippitts.voicelink.exception;
