package com.phillippitts.voicelink.service.postprocess;

import com.phillippitts.voicelink.config.properties.WordReplacementProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies configured whole-word replacements to transcripts.
 *
 * <p>Matching is case-insensitive and bounded by non-letter, non-digit characters, so the rule
 * {@code gonna -> going to} rewrites "Gonna go" but leaves "gonnas" alone. Longer phrases are
 * applied first so a multi-word rule wins over a rule for one of its words.
 *
 * <p>Rules are compiled once at construction; the service is immutable and thread-safe.
 */
@Component
public final class WordReplacementService {

    private static final Logger LOG = LogManager.getLogger(WordReplacementService.class);

    private final List<Rule> rules;

    @Autowired
    public WordReplacementService(WordReplacementProperties properties) {
        this(properties.rules());
    }

    WordReplacementService(Map<String, String> replacements) {
        List<Rule> compiled = new ArrayList<>();
        replacements.forEach((original, replacement) -> {
            if (original == null || original.isBlank() || replacement == null) {
                LOG.warn("Ignoring invalid word replacement rule: '{}'", original);
                return;
            }
            Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(original.trim())
                    + "(?![\\p{L}\\p{N}])", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            compiled.add(new Rule(original.trim(), pattern, Matcher.quoteReplacement(replacement)));
        });
        compiled.sort(Comparator.comparingInt((Rule r) -> r.original().length()).reversed()
                .thenComparing(Rule::original));
        this.rules = List.copyOf(compiled);
        LOG.debug("Loaded {} word replacement rule(s)", rules.size());
    }

    /**
     * Applies every rule in order.
     *
     * @param text transcript (null treated as empty)
     * @return replaced text and whether anything changed
     */
    public ReplacementResult apply(String text) {
        if (text == null || text.isEmpty() || rules.isEmpty()) {
            return new ReplacementResult(text == null ? "" : text, false);
        }
        String result = text;
        for (Rule rule : rules) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return new ReplacementResult(result, !result.equals(text));
    }

    public int ruleCount() {
        return rules.size();
    }

    private record Rule(String original, Pattern pattern, String replacement) {
    }
}
