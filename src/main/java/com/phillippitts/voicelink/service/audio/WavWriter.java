package com.phillippitts.voicelink.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes canonical 44-byte-header PCM WAV data.
 *
 * <p>The engine-facing file is always 16 kHz, 16-bit signed PCM, mono, little-endian; the general
 * {@link #encodePcm16Le(byte[], int, int)} form is used to build multi-channel fixtures.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file path (will be created or overwritten)
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try {
            Files.write(wavPath, encodePcm16Le(pcm, AudioFormat.TARGET_SAMPLE_RATE, AudioFormat.TARGET_CHANNELS));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Wraps interleaved PCM16LE samples in a RIFF/WAVE container.
     *
     * @param pcm interleaved little-endian 16-bit samples
     * @param sampleRate frames per second
     * @param channels channel count
     * @return complete WAV bytes
     */
    public static byte[] encodePcm16Le(byte[] pcm, int sampleRate, int channels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        int blockAlign = channels * 2;
        ByteArrayOutputStream os = new ByteArrayOutputStream(AudioFormat.WAV_HEADER_SIZE + pcm.length);
        try {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);                     // PCM fmt chunk size
            writeLEShort(os, 1);                    // PCM
            writeLEShort(os, channels);
            writeLEInt(os, sampleRate);
            writeLEInt(os, sampleRate * blockAlign); // byte rate
            writeLEShort(os, blockAlign);
            writeLEShort(os, 16);                   // bits per sample

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, pcm.length);
            os.write(pcm);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return os.toByteArray();
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
