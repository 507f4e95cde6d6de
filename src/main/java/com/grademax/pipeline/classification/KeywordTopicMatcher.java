package com.grademax.pipeline.classification;

import com.grademax.pipeline.classification.ClassificationModels.KeywordMatch;
import com.grademax.pipeline.config.PipelineProperties;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfile.TopicProfile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Component
public class KeywordTopicMatcher {
    static final double CORE_WEIGHT = 0.7;
    static final double SUPPORTING_WEIGHT = 0.3;
    static final double DOMINANCE_BONUS = 0.1;

    private final double cap;
    private final double saturation;
    private final double negativePenalty;
    private final Map<String, Pattern> termPatterns = new ConcurrentHashMap<>();

    public KeywordTopicMatcher(PipelineProperties properties) {
        PipelineProperties.Classification c = properties.classification();
        this.cap = Math.min(c.keywordConfidenceCap(), c.acceptanceThreshold());
        this.saturation = c.keywordSaturation() <= 0 ? 1.0 : c.keywordSaturation();
        this.negativePenalty = c.negativeTermPenalty();
    }

    public KeywordMatch match(String text, SubjectProfile profile) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

        int negativeHits = 0;
        for (String negative : profile.negativeTerms()) {
            if (lower.contains(negative)) {
                negativeHits++;
                lower = lower.replace(negative, " ");
            }
        }

        String best = null;
        double bestScore = 0;
        double runnerUp = 0;
        for (TopicProfile topic : profile.topics()) {
            double score = CORE_WEIGHT * hits(lower, topic.core()) + SUPPORTING_WEIGHT * hits(lower, topic.supporting());
            if (score > bestScore) {
                runnerUp = bestScore;
                bestScore = score;
                best = topic.code();
            } else if (score > runnerUp) {
                runnerUp = score;
            }
        }

        if (best == null) return new KeywordMatch(null, 0, 0, negativeHits);

        double confidence = Math.min(cap, bestScore / saturation);
        if (bestScore > 2 * runnerUp) confidence += DOMINANCE_BONUS;
        confidence -= negativePenalty * negativeHits;
        confidence = Math.max(0, Math.min(cap, confidence));
        return new KeywordMatch(best, bestScore, confidence, negativeHits);
    }

    private int hits(String text, List<String> terms) {
        int count = 0;
        String compact = null;
        for (String term : terms) {
            if (isWord(term)) {
                if (termPatterns.computeIfAbsent(term, this::wordPattern).matcher(text).find()) count++;
            } else {
                if (compact == null) compact = text.replaceAll("\\s+", "");
                if (compact.contains(term.replaceAll("\\s+", ""))) count++;
            }
        }
        return count;
    }

    private boolean isWord(String term) {
        return term.chars().allMatch(ch -> Character.isLetter(ch) || ch == ' ' || ch == '-');
    }

    private Pattern wordPattern(String term) {
        return Pattern.compile("(?<![a-z])" + Pattern.quote(term) + "(?![a-z])");
    }
}
