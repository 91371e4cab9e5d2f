package com.phillippitts.voicelink.exception;

/**
 * Thrown when a request form field carries a value outside its allowed set or range.
 */
public class InvalidParameterException extends VoiceLinkException {

    private final String parameter;

    public InvalidParameterException(String parameter, String value, String expected) {
        super("Invalid value '" + value + "' for '" + parameter + "': expected " + expected);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
