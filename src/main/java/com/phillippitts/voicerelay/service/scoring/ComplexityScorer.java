package com.phillippitts.voicerelay.service.scoring;

import com.phillippitts.voicerelay.config.properties.ScoringProperties;
import com.phillippitts.voicerelay.domain.ComplexityScore;
import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.util.TokenizerUtil;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scores the reasoning difficulty of a caller utterance.
 *
 * <p>The score is the weighted sum of three factors, capped at 1.0:
 * <ul>
 *   <li>length: {@code min(words / wordSaturation, 1.0)}, weight 0.3 by default</li>
 *   <li>pattern: share of configured complexity phrases found in the utterance as whole words,
 *       case-insensitively, weight 0.5</li>
 *   <li>context: added as-is, computed by the configured {@link ContextFactorPolicy}</li>
 * </ul>
 *
 * <p>Scoring is pure and never fails: a null or blank utterance contributes nothing, and a
 * null context counts as empty.
 *
 * <p><b>Thread Safety:</b> immutable after construction.
 */
@Service
public class ComplexityScorer {

    private final List<Pattern> patterns;
    private final int wordSaturation;
    private final double wordWeight;
    private final double patternWeight;
    private final ContextFactorPolicy contextPolicy;

    public ComplexityScorer(ScoringProperties props) {
        Objects.requireNonNull(props, "props");
        this.patterns = props.getPatterns().stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .map(ComplexityScorer::wholeWords)
                .toList();
        this.wordSaturation = props.getWordSaturation();
        this.wordWeight = props.getWordWeight();
        this.patternWeight = props.getPatternWeight();
        this.contextPolicy = ContextFactorPolicy.from(props);
    }

    /**
     * Scores one utterance.
     *
     * @param utterance caller text (nullable)
     * @param context   conversation so far (nullable)
     * @return score in [0.0, 1.0] with its factors
     */
    public ComplexityScore score(String utterance, ConversationContext context) {
        double wordFactor = Math.min((double) TokenizerUtil.wordCount(utterance) / wordSaturation, 1.0);
        double patternFactor = patternFactor(utterance);
        double contextFactor = contextPolicy.contextFactor(context == null ? ConversationContext.empty() : context);

        double raw = wordWeight * wordFactor + patternWeight * patternFactor + contextFactor;
        double value = Math.max(0.0, Math.min(raw, 1.0));
        return new ComplexityScore(value, wordFactor, patternFactor, contextFactor);
    }

    /** Number of configured complexity phrases. */
    public int patternCount() {
        return patterns.size();
    }

    private double patternFactor(String utterance) {
        if (utterance == null || utterance.isBlank() || patterns.isEmpty()) {
            return 0.0;
        }
        long matched = patterns.stream().filter(p -> p.matcher(utterance).find()).count();
        return (double) matched / patterns.size();
    }

    // phrase must start and end on a word boundary, so "calculate" does not match "miscalculated"
    static Pattern wholeWords(String phrase) {
        return Pattern.compile("(?<!\\w)" + Pattern.quote(phrase) + "(?!\\w)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
