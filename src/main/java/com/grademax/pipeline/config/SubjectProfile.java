package com.grademax.pipeline.config;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public record SubjectProfile(String subjectCode,
                             String name,
                             List<Pattern> highPriorityPatterns,
                             List<Pattern> lowPriorityPatterns,
                             List<String> validationKeywords,
                             int validationWindow,
                             List<String> denyList,
                             int minQuestion,
                             int maxQuestion,
                             int expectedMin,
                             int expectedMax,
                             double leftMarginMax,
                             String fallbackTopic,
                             List<TopicProfile> topics,
                             List<String> negativeTerms) {

    public record TopicProfile(String code, String name, List<String> core, List<String> supporting) {}

    public boolean knowsTopic(String code) {
        if (code == null) return false;
        return code.equals(fallbackTopic) || topics.stream().anyMatch(t -> t.code().equals(code));
    }

    public Optional<TopicProfile> topic(String code) {
        return topics.stream().filter(t -> t.code().equals(code)).findFirst();
    }

    public boolean inQuestionRange(int number) {
        return number >= minQuestion && number <= maxQuestion;
    }
}
