package com.phillippitts.voicelink.exception;

/**
 * Thrown when uploaded audio cannot be decoded or normalized to 16 kHz mono PCM.
 */
public class InvalidAudioException extends VoiceLinkException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(String reason, Throwable cause) {
        super("Invalid audio data: " + reason, cause);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
