package com.grademax.pipeline.assembly;

import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.QuestionUnit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class WorksheetModels {
    public record WorksheetCriteria(Set<String> topicCodes,
                                    Integer yearFrom,
                                    Integer yearTo,
                                    Difficulty difficulty,
                                    Integer maxCount,
                                    boolean shuffle,
                                    Long seed,
                                    Boolean wholeQuestionsOnly,
                                    String subjectCode) {
        public WorksheetCriteria {
            topicCodes = topicCodes == null ? Set.of() : Set.copyOf(topicCodes);
            if (wholeQuestionsOnly == null) wholeQuestionsOnly = Boolean.TRUE;
        }

        public List<String> problems() {
            List<String> problems = new ArrayList<>();
            if (maxCount == null || maxCount <= 0) problems.add("maxCount must be greater than 0");
            if (yearFrom != null && yearTo != null && yearFrom > yearTo) problems.add("yearFrom must not be after yearTo");
            if (topicCodes.stream().anyMatch(t -> t == null || t.isBlank())) problems.add("topic codes must not be blank");
            return problems;
        }
    }

    public record Worksheet(String id,
                            WorksheetCriteria criteria,
                            List<String> unitIds,
                            String worksheetUri,
                            String answerPackUri,
                            int totalMarks,
                            int estimatedMinutes,
                            Instant createdAt,
                            boolean stale) {}

    public record AssemblyResult(Worksheet worksheet, List<QuestionUnit> selectedUnits, int worksheetPages, int answerPages) {}
}
