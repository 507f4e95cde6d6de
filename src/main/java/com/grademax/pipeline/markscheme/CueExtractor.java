package com.grademax.pipeline.markscheme;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class CueExtractor {
    private static final Pattern FORMULA = Pattern.compile("\\b([A-Za-z]{1,3})\\s*=\\s*([A-Za-z0-9][A-Za-z0-9 +\\-*/×÷^²³().]{0,30})");
    private static final Pattern QUANTITY = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(m/s²|m/s\\^?2|m/s|km/h|kg|g|mm|cm|km|m|s|N|J|kJ|W|kW|V|A|Hz|Pa|kPa|°C|K|Ω|ohms?|%)(?![A-Za-z])");
    private static final Pattern UNIT = Pattern.compile("\\b(newtons?|joules?|watts?|volts?|amps?|amperes?|hertz|pascals?|ohms?|kelvin|metres?|seconds?|kilograms?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[a-z]{5,}");
    private static final Set<String> STOP_WORDS = Set.of(
            "about", "above", "after", "again", "answer", "because", "below", "between", "could", "describe", "explain",
            "should", "state", "their", "there", "these", "which", "while", "would", "where", "other", "correct", "allow",
            "ignore", "award", "marks", "question", "calculate", "using", "shown", "given", "value", "total");

    public Set<String> extract(String text) {
        Set<String> cues = new HashSet<>();
        if (text == null || text.isBlank()) return cues;

        Matcher formula = FORMULA.matcher(text);
        while (formula.find()) {
            cues.add("f:" + (formula.group(1) + "=" + formula.group(2)).replaceAll("\\s+", "").toLowerCase(Locale.ROOT));
        }
        Matcher quantity = QUANTITY.matcher(text);
        while (quantity.find()) {
            cues.add("q:" + quantity.group(1) + quantity.group(2).toLowerCase(Locale.ROOT));
            cues.add("u:" + quantity.group(2).toLowerCase(Locale.ROOT));
        }
        Matcher unit = UNIT.matcher(text);
        while (unit.find()) {
            cues.add("u:" + unitSymbol(unit.group(1).toLowerCase(Locale.ROOT)));
        }
        Matcher word = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (word.find()) {
            if (!STOP_WORDS.contains(word.group())) cues.add("w:" + word.group());
        }
        return cues;
    }

    public double jaccard(String a, String b) {
        Set<String> left = extract(a);
        Set<String> right = extract(b);
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private String unitSymbol(String word) {
        if (word.startsWith("newton")) return "n";
        if (word.startsWith("joule")) return "j";
        if (word.startsWith("watt")) return "w";
        if (word.startsWith("volt")) return "v";
        if (word.startsWith("amp")) return "a";
        if (word.startsWith("hertz")) return "hz";
        if (word.startsWith("pascal")) return "pa";
        if (word.startsWith("ohm")) return "ω";
        if (word.startsWith("kelvin")) return "k";
        if (word.startsWith("metre")) return "m";
        if (word.startsWith("second")) return "s";
        return "kg";
    }
}
