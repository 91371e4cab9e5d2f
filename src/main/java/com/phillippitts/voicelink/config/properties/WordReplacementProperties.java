package com.phillippitts.voicelink.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Whole-word replacements applied to every transcript.
 *
 * <pre>
 * transcription.word-replacement.enabled=true
 * transcription.word-replacement.rules[gonna]=going to
 * transcription.word-replacement.rules[voice ink]=VoiceInk
 * </pre>
 *
 * @param enabled initial value of the word-replacement toggle
 * @param rules original phrase to replacement; matching is case-insensitive
 */
@ConfigurationProperties(prefix = "transcription.word-replacement")
public record WordReplacementProperties(
        @DefaultValue("false") boolean enabled,
        Map<String, String> rules
) {
    public WordReplacementProperties {
        rules = rules == null ? Map.of() : Map.copyOf(rules);
    }
}
