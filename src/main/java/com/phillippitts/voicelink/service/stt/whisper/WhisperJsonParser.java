package com.phillippitts.voicelink.service.stt.whisper;

import com.phillippitts.voicelink.exception.TranscriptionException;
import com.phillippitts.voicelink.service.stt.EngineTranscript;
import com.phillippitts.voicelink.service.stt.TranscriptSegment;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses whisper JSON output into an {@link EngineTranscript}.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>whisper.cpp {@code -oj}: {@code transcription[]} with {@code offsets.from/to} in milliseconds,
 *       optional {@code speaker_turn_next} (tinydiarize) and per-token probabilities {@code p}</li>
 *   <li>OpenAI style: {@code segments[]} with {@code start/end} in seconds and a top-level {@code text}</li>
 * </ul>
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @throws TranscriptionException when the output is not valid JSON
     */
    static EngineTranscript parse(String json) {
        if (json == null || json.isBlank()) {
            return new EngineTranscript("", List.of());
        }
        try {
            JSONObject obj = new JSONObject(json);
            List<TranscriptSegment> segments = obj.has("transcription")
                    ? fromCppTranscription(obj.optJSONArray("transcription"))
                    : fromSegments(obj.optJSONArray("segments"));

            String text = obj.optString("text", "").trim();
            if (text.isEmpty()) {
                text = joinText(segments);
            }
            return new EngineTranscript(text, segments);
        } catch (JSONException e) {
            throw new TranscriptionException("Unparseable whisper output: " + e.getMessage(), "whisper", e);
        }
    }

    private static List<TranscriptSegment> fromCppTranscription(JSONArray items) {
        List<TranscriptSegment> segments = new ArrayList<>();
        if (items == null) {
            return segments;
        }
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String text = item.optString("text", "").trim();
            JSONObject offsets = item.optJSONObject("offsets");
            if (text.isEmpty() || offsets == null) {
                continue;
            }
            double start = offsets.optLong("from", 0) / 1000.0;
            double end = offsets.optLong("to", 0) / 1000.0;
            boolean turn = item.optBoolean("speaker_turn_next", false);
            segments.add(new TranscriptSegment(start, end, text, meanTokenProbability(item.optJSONArray("tokens")), turn));
        }
        return segments;
    }

    private static List<TranscriptSegment> fromSegments(JSONArray items) {
        List<TranscriptSegment> segments = new ArrayList<>();
        if (items == null) {
            return segments;
        }
        for (int i = 0; i < items.length(); i++) {
            JSONObject seg = items.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String text = seg.optString("text", "").trim();
            if (text.isEmpty()) {
                continue;
            }
            Double confidence = seg.has("avg_logprob")
                    ? Math.min(1.0, Math.exp(seg.optDouble("avg_logprob", 0)))
                    : null;
            segments.add(new TranscriptSegment(seg.optDouble("start", 0), seg.optDouble("end", 0), text,
                    confidence, seg.optBoolean("speaker_turn_next", false)));
        }
        return segments;
    }

    private static Double meanTokenProbability(JSONArray tokens) {
        if (tokens == null || tokens.length() == 0) {
            return null;
        }
        double sum = 0;
        int count = 0;
        for (int i = 0; i < tokens.length(); i++) {
            JSONObject token = tokens.optJSONObject(i);
            if (token == null || !token.has("p")) {
                continue;
            }
            // Special tokens such as [_BEG_] and [_TT_123] carry no meaningful probability
            if (token.optString("text", "").startsWith("[_")) {
                continue;
            }
            sum += token.optDouble("p", 0);
            count++;
        }
        return count == 0 ? null : sum / count;
    }

    private static String joinText(List<TranscriptSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment segment : segments) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(segment.text());
        }
        return sb.toString();
    }
}
