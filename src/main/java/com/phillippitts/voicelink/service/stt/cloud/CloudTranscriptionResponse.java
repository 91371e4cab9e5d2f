package com.phillippitts.voicelink.service.stt.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code verbose_json} body returned by an OpenAI-compatible transcription endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CloudTranscriptionResponse(String text, String language, Double duration, List<Segment> segments) {

    CloudTranscriptionResponse {
        text = text == null ? "" : text;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Segment(double start, double end, String text,
                   @JsonProperty("avg_logprob") Double avgLogprob) {
    }
}
