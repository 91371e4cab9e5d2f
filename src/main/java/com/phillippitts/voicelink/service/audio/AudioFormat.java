package com.phillippitts.voicelink.service.audio;

/**
 * Single source of truth for the normalized engine format.
 * Engines receive 16 kHz, 16-bit signed PCM, mono, little-endian WAV.
 */
public final class AudioFormat {

    /** Target sample rate in Hz. */
    public static final int TARGET_SAMPLE_RATE = 16_000;
    /** Target bits per sample. */
    public static final int TARGET_BITS_PER_SAMPLE = 16;
    /** Target number of channels (mono). */
    public static final int TARGET_CHANNELS = 1;

    /** Bytes per PCM frame at the target format. */
    public static final int TARGET_BLOCK_ALIGN = (TARGET_BITS_PER_SAMPLE / 8) * TARGET_CHANNELS; // 2 bytes
    /** Bytes per second at the target format. */
    public static final int TARGET_BYTE_RATE = TARGET_SAMPLE_RATE * TARGET_BLOCK_ALIGN;          // 32,000

    /** Size of the canonical PCM WAV header written by {@link WavWriter}. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}
}
