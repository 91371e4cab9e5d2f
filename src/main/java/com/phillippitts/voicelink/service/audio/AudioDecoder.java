package com.phillippitts.voicelink.service.audio;

import com.phillippitts.voicelink.exception.InvalidAudioException;

import java.nio.file.Path;

/**
 * Converts an uploaded audio file into {@link DecodedAudio}.
 */
public interface AudioDecoder {

    /**
     * @return true when this decoder can attempt the given container
     */
    boolean supports(AudioContainer container);

    /**
     * Decodes and resamples the file to 16 kHz.
     *
     * @param file uploaded audio on disk
     * @param container sniffed container
     * @throws InvalidAudioException if the audio cannot be decoded
     */
    DecodedAudio decode(Path file, AudioContainer container);
}
