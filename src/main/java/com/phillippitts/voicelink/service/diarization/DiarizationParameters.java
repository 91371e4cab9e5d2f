package com.phillippitts.voicelink.service.diarization;

import com.phillippitts.voicelink.exception.InvalidParameterException;

import java.util.Locale;
import java.util.Map;

/**
 * Diarization options sent as multipart form fields.
 *
 * <pre>
 * enable_diarization   true|false|1|0|yes|no   (default false)
 * diarization_mode     fast|balanced|accurate  (default balanced)
 * min_speakers         positive integer        (optional)
 * max_speakers         positive integer        (optional, &gt;= min_speakers)
 * use_tinydiarize      boolean                 (default false)
 * diarization_method   auto|stereo|tinydiarize|pyannote|none (default auto)
 * </pre>
 *
 * {@code diarization_method=none} turns diarization off even when {@code enable_diarization} is set.
 *
 * @param method explicit method, or null to select automatically
 */
public record DiarizationParameters(boolean enabled, DiarizationMode mode, Integer minSpeakers,
                                    Integer maxSpeakers, boolean useTinydiarize, DiarizationMethod method) {

    public static final DiarizationParameters DISABLED =
            new DiarizationParameters(false, DiarizationMode.BALANCED, null, null, false, null);

    public DiarizationParameters {
        mode = mode == null ? DiarizationMode.BALANCED : mode;
    }

    /**
     * Parses form fields. Absent fields take their defaults.
     *
     * @throws InvalidParameterException for unparseable or out-of-range values
     */
    public static DiarizationParameters fromFields(Map<String, String> fields) {
        boolean enabled = bool(fields, "enable_diarization");
        boolean tinydiarize = bool(fields, "use_tinydiarize");

        DiarizationMode mode = DiarizationMode.BALANCED;
        String modeValue = fields.get("diarization_mode");
        if (present(modeValue)) {
            try {
                mode = DiarizationMode.fromWire(modeValue);
            } catch (IllegalArgumentException e) {
                throw new InvalidParameterException("diarization_mode", modeValue, "fast, balanced or accurate");
            }
        }

        DiarizationMethod method = null;
        String methodValue = fields.get("diarization_method");
        if (present(methodValue) && methodValue.trim().equalsIgnoreCase("none")) {
            enabled = false;
        } else if (present(methodValue)) {
            try {
                method = DiarizationMethod.fromWire(methodValue);
            } catch (IllegalArgumentException e) {
                throw new InvalidParameterException("diarization_method", methodValue,
                        "auto, stereo, tinydiarize, pyannote or none");
            }
        }

        Integer min = positiveInt(fields, "min_speakers");
        Integer max = positiveInt(fields, "max_speakers");
        if (min != null && max != null && min > max) {
            throw new InvalidParameterException("max_speakers", String.valueOf(max),
                    "a value >= min_speakers (" + min + ")");
        }
        return new DiarizationParameters(enabled, mode, min, max, tinydiarize, method);
    }

    private static boolean bool(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (!present(value)) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes":
                return true;
            case "false", "0", "no":
                return false;
            default:
                throw new InvalidParameterException(name, value, "true, false, 1, 0, yes or no");
        }
    }

    private static Integer positiveInt(Map<String, String> fields, String name) {
        String value = fields.get(name);
        if (!present(value)) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new InvalidParameterException(name, value, "a positive integer");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, value, "a positive integer");
        }
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
