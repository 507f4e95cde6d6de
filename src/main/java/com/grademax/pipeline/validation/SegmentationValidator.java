package com.grademax.pipeline.validation;

import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

import static com.grademax.pipeline.domain.PipelineIssue.Codes.SEGMENTATION_WARNING;

@Component
public class SegmentationValidator {
    public List<PipelineIssue> validate(List<QuestionUnit> units, SubjectProfile profile) {
        List<PipelineIssue> issues = new ArrayList<>();

        duplicate(units, issues);

        long questions = units.stream().filter(QuestionUnit::isWholeQuestion).count();
        if (questions < profile.expectedMin() || questions > profile.expectedMax()) {
            issues.add(PipelineIssue.paper(SEGMENTATION_WARNING,
                    "Found " + questions + " questions, expected " + profile.expectedMin() + "-" + profile.expectedMax()
                            + " for subject " + profile.subjectCode()));
        }

        units.stream().filter(u -> u.getPageRanges().isEmpty()).forEach(u ->
                issues.add(PipelineIssue.unit(SEGMENTATION_WARNING, "No page range recorded for " + u, u)));

        Map<String, List<QuestionUnit>> byQuestion = units.stream()
                .collect(Collectors.groupingBy(QuestionUnit::getQuestionNumber, LinkedHashMap::new, Collectors.toList()));
        byQuestion.forEach((number, group) -> group.stream().filter(QuestionUnit::isWholeQuestion).findFirst().ifPresent(q -> {
            int partSum = group.stream()
                    .filter(u -> !u.isWholeQuestion() && !u.getPartCode().contains("("))
                    .map(QuestionUnit::getMarkValue)
                    .filter(Objects::nonNull)
                    .mapToInt(Integer::intValue)
                    .sum();
            if (q.getMarkValue() != null && partSum > 0 && partSum != q.getMarkValue()) {
                issues.add(PipelineIssue.unit(SEGMENTATION_WARNING,
                        "Parts of question " + number + " add up to " + partSum + " but the question total is " + q.getMarkValue(), q));
            }
        }));

        return issues;
    }

    private void duplicate(List<QuestionUnit> units, List<PipelineIssue> issues) {
        Map<String, Long> counts = units.stream().collect(Collectors.groupingBy(this::key, Collectors.counting()));
        Set<String> reported = new HashSet<>();
        units.forEach(u -> {
            if (counts.getOrDefault(key(u), 0L) > 1 && reported.add(key(u))) {
                issues.add(PipelineIssue.unit(SEGMENTATION_WARNING, "Duplicate question unit: " + u, u));
            }
        });
    }

    private String key(QuestionUnit unit) {
        return unit.getQuestionNumber() + "|" + unit.getPartCode();
    }
}
