package com.grademax.pipeline.service;

import com.grademax.pipeline.domain.DomainModels.PaperMetadata;
import com.grademax.pipeline.service.IngestionModels.MetadataHints;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class MetadataDetector {
    static final String UNKNOWN = "Unknown";

    private static final String MONTHS = "jan|feb|mar|may|jun|oct|nov|sum|win";
    private static final Pattern EDEXCEL = Pattern.compile(
            "(\\d[A-Z]{2,3}\\d)_(\\d[A-Z]+)(?:_MS)?.*?(" + MONTHS + ")[a-z]*.*?(\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMBRIDGE = Pattern.compile("(\\d{4})_([swm])(\\d{2})_(qp|ms)_(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern AQA = Pattern.compile("(\\d{4})-(\\d[HF])-([QM][PS])-([A-Z]{3})(\\d{2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBJECT_CODE = Pattern.compile("\\b(\\d[A-Z]{2,3}\\d|\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(20\\d{2})(?!\\d)");
    private static final Pattern MONTH = Pattern.compile("(january|february|march|june|october|november|summer|winter|" + MONTHS + ")",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> SEASONS = Map.of(
            "jan", "January", "feb", "February", "mar", "March", "may", "May", "jun", "June",
            "oct", "October", "nov", "November", "sum", "Summer", "win", "Winter");
    private static final Map<String, String> CAMBRIDGE_SEASONS = Map.of("s", "Summer", "w", "Winter", "m", "March");

    public MetadataHints detect(String filename) {
        if (filename == null || filename.isBlank()) return MetadataHints.none();
        String name = filename.replaceAll(".*[/\\\\]", "").replaceFirst("(?i)\\.pdf$", "");

        Matcher m = EDEXCEL.matcher(name);
        if (m.find()) {
            return new MetadataHints("Edexcel", "IGCSE", m.group(1).toUpperCase(Locale.ROOT), Integer.parseInt(m.group(4)),
                    season(m.group(3)), m.group(2).toUpperCase(Locale.ROOT));
        }
        m = CAMBRIDGE.matcher(name);
        if (m.find()) {
            return new MetadataHints("Cambridge", "IGCSE", m.group(1), 2000 + Integer.parseInt(m.group(3)),
                    CAMBRIDGE_SEASONS.get(m.group(2).toLowerCase(Locale.ROOT)), m.group(5));
        }
        m = AQA.matcher(name);
        if (m.find()) {
            return new MetadataHints("AQA", "GCSE", m.group(1), 2000 + Integer.parseInt(m.group(5)),
                    season(m.group(4)), m.group(2).toUpperCase(Locale.ROOT));
        }

        Matcher code = SUBJECT_CODE.matcher(name.replace('_', ' ').replace('-', ' '));
        Matcher year = YEAR.matcher(name);
        Matcher month = MONTH.matcher(name);
        String subject = null;
        while (code.find()) {
            // a bare four-digit group starting with 20 is more likely the year
            if (!code.group(1).matches("20\\d{2}")) {
                subject = code.group(1).toUpperCase(Locale.ROOT);
                break;
            }
        }
        return new MetadataHints(null, null, subject, year.find() ? Integer.valueOf(year.group(1)) : null,
                month.find() ? season(month.group(1)) : null, null);
    }

    public PaperMetadata resolve(String filename, MetadataHints supplied) {
        MetadataHints hints = supplied == null ? MetadataHints.none() : supplied;
        MetadataHints detected = detect(filename);

        String subject = first(hints.subjectCode(), detected.subjectCode());
        Integer year = hints.year() != null ? hints.year() : detected.year();
        String paperNumber = first(hints.paperNumber(), detected.paperNumber());

        List<String> missing = new ArrayList<>();
        if (subject == null) missing.add("subjectCode");
        if (year == null) missing.add("year");
        if (paperNumber == null) missing.add("paperNumber");
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Cannot determine " + String.join(", ", missing) + " for " + filename);
        }

        return new PaperMetadata(
                orUnknown(first(hints.board(), detected.board())),
                orUnknown(first(hints.level(), detected.level())),
                subject.trim(),
                year,
                orUnknown(first(hints.season(), detected.season())),
                paperNumber.trim());
    }

    private static String season(String code) {
        String lower = code.toLowerCase(Locale.ROOT);
        String shortCode = lower.length() > 3 ? lower.substring(0, 3) : lower;
        return SEASONS.getOrDefault(shortCode, code);
    }

    private static String first(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
