package com.phillippitts.voicelink.service.audio;

/**
 * Audio container formats recognised from magic bytes.
 */
public enum AudioContainer {
    MP3("mp3", "audio/mpeg"),
    WAV("wav", "audio/wav"),
    M4A("m4a", "audio/mp4"),
    FLAC("flac", "audio/flac"),
    OGG("ogg", "audio/ogg"),
    WEBM("webm", "audio/webm"),
    UNKNOWN("bin", "application/octet-stream");

    private final String extension;
    private final String contentType;

    AudioContainer(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    /** File extension (without dot) used to name temporary copies. */
    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }
}
