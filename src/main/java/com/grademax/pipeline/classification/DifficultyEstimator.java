package com.grademax.pipeline.classification;

import com.grademax.pipeline.domain.DomainModels.Difficulty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class DifficultyEstimator {
    private static final List<Pattern> HARD_VERBS = verbs("evaluate", "derive", "justify", "assess", "analyse", "analyze",
            "compare", "explain why", "discuss", "deduce", "predict");
    private static final List<Pattern> MEDIUM_VERBS = verbs("calculate", "explain", "describe", "show", "determine",
            "estimate", "suggest", "plot", "sketch");

    public Difficulty estimate(String text, Integer marks) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        int value = marks == null ? 0 : marks;
        if (value >= 7 || HARD_VERBS.stream().anyMatch(p -> p.matcher(lower).find())) return Difficulty.HARD;
        if (value >= 4 || MEDIUM_VERBS.stream().anyMatch(p -> p.matcher(lower).find())) return Difficulty.MEDIUM;
        return Difficulty.EASY;
    }

    private static List<Pattern> verbs(String... verbs) {
        return List.of(verbs).stream().map(v -> Pattern.compile("\\b" + Pattern.quote(v) + "\\b")).toList();
    }
}
