package com.grademax.pipeline.config;

import com.grademax.pipeline.config.PipelineProperties.Subject;
import com.grademax.pipeline.config.SubjectProfile.TopicProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
public class SubjectProfiles {
    private static final Logger log = LoggerFactory.getLogger(SubjectProfiles.class);

    public static final String DEFAULT_KEY = "default";

    private static final Subject BUILT_IN = new Subject(
            "Generic",
            List.of("^(\\d{1,2})\\s+[A-Z(]"),
            List.of("^(\\d{1,2})$"),
            List.of("calculate", "explain", "state", "describe", "show", "give", "suggest", "complete", "write", "determine"),
            15,
            List.of("turn over", "do not write in this area", "answer all questions", "continued", "total for paper",
                    "blank page", "question number", "leave blank"),
            1, 20, 1, 20, 100.0,
            "UNCLASSIFIED",
            List.of(),
            List.of());

    private final Map<String, SubjectProfile> profiles;
    private final SubjectProfile defaults;

    public SubjectProfiles(PipelineProperties properties) {
        Subject configuredDefault = merge(properties.subjects().get(DEFAULT_KEY), BUILT_IN);
        this.defaults = compile(DEFAULT_KEY, configuredDefault);

        Map<String, SubjectProfile> compiled = new HashMap<>();
        properties.subjects().forEach((code, subject) -> {
            if (DEFAULT_KEY.equals(code)) return;
            compiled.put(code.toUpperCase(Locale.ROOT), compile(code.toUpperCase(Locale.ROOT), merge(subject, configuredDefault)));
        });
        this.profiles = Map.copyOf(compiled);
        log.info("Loaded {} subject profiles: {}", profiles.size(), new TreeSet<>(profiles.keySet()));
    }

    public SubjectProfile forSubject(String subjectCode) {
        if (subjectCode == null) return defaults;
        SubjectProfile profile = profiles.get(subjectCode.toUpperCase(Locale.ROOT));
        if (profile != null) return profile;
        return new SubjectProfile(subjectCode, defaults.name(), defaults.highPriorityPatterns(), defaults.lowPriorityPatterns(),
                defaults.validationKeywords(), defaults.validationWindow(), defaults.denyList(),
                defaults.minQuestion(), defaults.maxQuestion(), defaults.expectedMin(), defaults.expectedMax(),
                defaults.leftMarginMax(), defaults.fallbackTopic(), defaults.topics(), defaults.negativeTerms());
    }

    public Set<String> subjectCodes() {
        return profiles.keySet();
    }

    private Subject merge(Subject s, Subject base) {
        if (s == null) return base;
        return new Subject(
                pick(s.name(), base.name()),
                pick(s.highPriorityPatterns(), base.highPriorityPatterns()),
                pick(s.lowPriorityPatterns(), base.lowPriorityPatterns()),
                pick(s.validationKeywords(), base.validationKeywords()),
                pick(s.validationWindow(), base.validationWindow()),
                pick(s.denyList(), base.denyList()),
                pick(s.minQuestion(), base.minQuestion()),
                pick(s.maxQuestion(), base.maxQuestion()),
                pick(s.expectedMin(), base.expectedMin()),
                pick(s.expectedMax(), base.expectedMax()),
                pick(s.leftMarginMax(), base.leftMarginMax()),
                pick(s.fallbackTopic(), base.fallbackTopic()),
                pick(s.topics(), base.topics()),
                pick(s.negativeTerms(), base.negativeTerms()));
    }

    private static <T> T pick(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private SubjectProfile compile(String code, Subject s) {
        List<TopicProfile> topics = s.topics().stream()
                .filter(t -> t.code() != null && !t.code().isBlank())
                .map(t -> new TopicProfile(t.code(), t.name() == null ? t.code() : t.name(),
                        lower(t.core()), lower(t.supporting())))
                .toList();
        if (s.minQuestion() > s.maxQuestion()) {
            throw new IllegalStateException("Subject " + code + ": minQuestion > maxQuestion");
        }
        return new SubjectProfile(code, s.name(),
                patterns(code, s.highPriorityPatterns()),
                patterns(code, s.lowPriorityPatterns()),
                lower(s.validationKeywords()),
                s.validationWindow(),
                lower(s.denyList()),
                s.minQuestion(), s.maxQuestion(), s.expectedMin(), s.expectedMax(),
                s.leftMarginMax(),
                s.fallbackTopic(),
                topics,
                lower(s.negativeTerms()));
    }

    private List<Pattern> patterns(String code, List<String> sources) {
        return sources.stream().map(p -> {
            try {
                return Pattern.compile(p);
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Subject " + code + ": invalid pattern " + p, e);
            }
        }).toList();
    }

    private List<String> lower(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).map(v -> v.toLowerCase(Locale.ROOT).trim())
                .filter(v -> !v.isEmpty()).toList();
    }
}
