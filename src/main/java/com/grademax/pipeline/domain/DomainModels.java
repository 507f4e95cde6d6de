package com.grademax.pipeline.domain;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class DomainModels {
    public record PaperMetadata(String board, String level, String subjectCode,
                                int year, String season, String paperNumber) {
        public String canonicalKey() {
            return String.join("/", board, level, subjectCode, String.valueOf(year), season, paperNumber);
        }
    }

    public record Paper(String id, PaperMetadata metadata,
                        String questionPaperUri, String markSchemeUri,
                        int totalQuestions, int revision, Instant ingestedAt) {}

    public record Rect(double x, double y, double width, double height) {}

    public record PageRange(int pageIndex, Rect region) {}

    public record MarkPoint(String text, int value) {}

    public record MarkSchemeLink(String questionUnitId,
                                 List<MarkPoint> markPoints,
                                 String rawSnippet,
                                 double confidence,
                                 MatchMethod matchMethod,
                                 List<PageRange> markSchemePages) {
        public boolean matched() {
            return matchMethod != MatchMethod.UNMATCHED;
        }

        public int pointTotal() {
            return markPoints.stream().mapToInt(MarkPoint::value).sum();
        }
    }

    public record Classification(String topicCode, Difficulty difficulty, double confidence, ClassificationMethod method) {}

    public enum MatchMethod { EXACT, FUZZY, MARKS_ONLY, UNMATCHED }

    public enum ClassificationMethod { KEYWORD, EXTERNAL, FALLBACK }

    public enum Difficulty {
        EASY, MEDIUM, HARD;

        public static Difficulty fromLabel(String label) {
            if (label == null || label.isBlank()) return null;
            return switch (label.trim().toLowerCase(Locale.ROOT)) {
                case "easy", "1" -> EASY;
                case "medium", "2" -> MEDIUM;
                case "hard", "3" -> HARD;
                default -> null;
            };
        }
    }
}
