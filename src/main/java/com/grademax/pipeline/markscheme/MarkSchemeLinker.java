package com.grademax.pipeline.markscheme;

import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.MatchMethod;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class MarkSchemeLinker {
    private static final Logger log = LoggerFactory.getLogger(MarkSchemeLinker.class);

    static final double KEY_WEIGHT = 0.4;
    static final double MARKS_WEIGHT = 0.3;
    static final double CUE_WEIGHT = 0.3;
    private static final int MAX_SNIPPET = 2000;

    private final CueExtractor cueExtractor;

    public MarkSchemeLinker(CueExtractor cueExtractor) {
        this.cueExtractor = cueExtractor;
    }

    public LinkResult link(List<QuestionUnit> units, List<MarkSchemeEntry> entries) {
        Map<String, MarkSchemeEntry> exact = new LinkedHashMap<>();
        Map<String, MarkSchemeEntry> fuzzy = new LinkedHashMap<>();
        entries.forEach(e -> {
            exact.putIfAbsent(e.questionNumber() + "|" + e.partCode(), e);
            fuzzy.putIfAbsent(normalize(e.questionNumber(), e.partCode()), e);
        });

        Set<MarkSchemeEntry> claimed = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<String, MarkSchemeLink> links = new LinkedHashMap<>();

        for (QuestionUnit unit : units) {
            MarkSchemeEntry entry = exact.get(unit.getQuestionNumber() + "|" + unit.getPartCode());
            MatchMethod method = MatchMethod.EXACT;
            if (entry == null) {
                MarkSchemeEntry candidate = fuzzy.get(normalize(unit.getQuestionNumber(), unit.getPartCode()));
                entry = candidate == null || claimed.contains(candidate) ? null : candidate;
                method = MatchMethod.FUZZY;
            }
            if (entry != null) {
                claimed.add(entry);
                links.put(unit.getId(), toLink(unit, entry, method));
            }
        }

        List<PipelineIssue> issues = new ArrayList<>();
        for (QuestionUnit unit : units) {
            if (links.containsKey(unit.getId())) continue;
            Optional<MarkSchemeEntry> byMarks = entries.stream()
                    .filter(e -> !claimed.contains(e))
                    .filter(e -> stripZeros(e.questionNumber()).equals(stripZeros(unit.getQuestionNumber())))
                    .filter(e -> unit.getMarkValue() != null && unit.getMarkValue().equals(e.marks()))
                    .findFirst();
            if (byMarks.isPresent()) {
                claimed.add(byMarks.get());
                links.put(unit.getId(), toLink(unit, byMarks.get(), MatchMethod.MARKS_ONLY));
            } else {
                links.put(unit.getId(), new MarkSchemeLink(unit.getId(), List.of(), "", 0.0, MatchMethod.UNMATCHED, List.of()));
                issues.add(PipelineIssue.unit(PipelineIssue.Codes.LINKING_UNMATCHED, "No mark-scheme entry for " + unit, unit));
            }
        }

        List<MarkSchemeLink> ordered = units.stream().map(u -> links.get(u.getId())).toList();
        long matched = ordered.stream().filter(MarkSchemeLink::matched).count();
        log.debug("Linked {}/{} units against {} mark-scheme entries", matched, units.size(), entries.size());
        return new LinkResult(ordered, issues);
    }

    private MarkSchemeLink toLink(QuestionUnit unit, MarkSchemeEntry entry, MatchMethod method) {
        double key = switch (method) {
            case EXACT -> 1.0;
            case FUZZY -> 0.5;
            default -> 0.0;
        };
        double marks = markAgreement(unit.getMarkValue(), entry.marks());
        double cues = cueExtractor.jaccard(unit.getText(), entry.rawText());
        double confidence = clamp(KEY_WEIGHT * key + MARKS_WEIGHT * marks + CUE_WEIGHT * cues);
        String snippet = entry.rawText().length() > MAX_SNIPPET ? entry.rawText().substring(0, MAX_SNIPPET) : entry.rawText();
        return new MarkSchemeLink(unit.getId(), entry.markPoints(), snippet, confidence, method, entry.pageRanges());
    }

    static double markAgreement(Integer unitMarks, Integer entryMarks) {
        if (unitMarks == null || entryMarks == null) return 0.0;
        int diff = Math.abs(unitMarks - entryMarks);
        if (diff == 0) return 1.0;
        return diff == 1 ? 0.5 : 0.0;
    }

    static String normalize(String questionNumber, String partCode) {
        String part = partCode == null ? "" : partCode.replaceAll("[\\s()\\[\\]{}.]", "").toLowerCase(Locale.ROOT);
        return stripZeros(questionNumber) + "|" + part;
    }

    private static String stripZeros(String questionNumber) {
        String trimmed = questionNumber.trim().replaceFirst("^0+(?=\\d)", "");
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public record LinkResult(List<MarkSchemeLink> links, List<PipelineIssue> issues) {}
}
