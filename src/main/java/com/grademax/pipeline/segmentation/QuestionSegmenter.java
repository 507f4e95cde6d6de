package com.grademax.pipeline.segmentation;

import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfiles;
import com.grademax.pipeline.document.DocumentModels.LocatedLine;
import com.grademax.pipeline.document.DocumentModels.PaperDocument;
import com.grademax.pipeline.document.PageRegions;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.DomainModels.PaperMetadata;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.SegmentationFailure;
import com.grademax.pipeline.markscheme.MarkSchemeModels.Layout;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeParse;
import com.grademax.pipeline.markscheme.MarkSchemeParser;
import com.grademax.pipeline.validation.SegmentationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.grademax.pipeline.domain.PipelineIssue.Codes.SEGMENTATION_WARNING;

/**
 * Splits a question paper into question, part and sub-part units.
 *
 * <p>A question starts at a left-margin line matching one of the subject's start patterns with a
 * number above the current one. Parts {@code (a)..(h)} and sub-parts {@code (i)..(x)} nest under it.
 * A "Total for Question N = X marks" fence closes question N; part markers after it are not attached.
 */
@Component
public class QuestionSegmenter {
    private static final Logger log = LoggerFactory.getLogger(QuestionSegmenter.class);

    private static final Pattern FENCE = Pattern.compile("Total\\s+for\\s+Question\\s+(\\d{1,2})\\s*=\\s*(\\d{1,3})\\s*marks?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PART = Pattern.compile("^\\(([a-h])\\)\\s*(?:\\((i|ii|iii|iv|v|vi|vii|viii|ix|x)\\))?\\s*(.*)$");
    private static final Pattern SUB_PART = Pattern.compile("^\\((i|ii|iii|iv|v|vi|vii|viii|ix|x)\\)\\s*(.*)$");
    private static final Pattern TRAILING_MARKS = Pattern.compile("(?:\\((\\d{1,2})\\)|\\[(\\d{1,2})(?:\\s*marks?)?])\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARCODE = Pattern.compile("^\\*[A-Z0-9]{6,}\\*$");
    private static final Pattern DIAGRAM = Pattern.compile("\\b(diagram|figure|fig\\.|graph|photograph|drawing)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> ROMANS = List.of("i", "ii", "iii", "iv", "v", "vi", "vii", "viii", "ix", "x");
    private static final double PART_INDENT = 80;
    static final int MAX_TEXT = 4000;

    private final SubjectProfiles profiles;
    private final MarkSchemeParser markSchemeParser;
    private final SegmentationValidator validator;

    public QuestionSegmenter(SubjectProfiles profiles, MarkSchemeParser markSchemeParser, SegmentationValidator validator) {
        this.profiles = profiles;
        this.markSchemeParser = markSchemeParser;
        this.validator = validator;
    }

    public SegmentationResult segment(String paperId, PaperDocument questionDoc, PaperDocument markSchemeDoc, PaperMetadata meta) {
        SubjectProfile profile = profiles.forSubject(meta.subjectCode());
        List<PipelineIssue> warnings = new ArrayList<>();

        List<QuestionUnit> units = segmentQuestions(paperId, questionDoc, profile, meta.paperNumber(), warnings);
        warnings.addAll(validator.validate(units, profile));

        MarkSchemeParse markScheme = markSchemeParser.parse(markSchemeDoc, profile);
        if (markSchemeDoc != null && markScheme.entries().isEmpty()) {
            warnings.add(PipelineIssue.paper(SEGMENTATION_WARNING, "No entries found in mark scheme"));
        }

        warnings.forEach(w -> log.warn("Paper {}: {} {}", meta.canonicalKey(), w.code(), w.message()));
        log.info("Paper {}: {} units ({} questions), {} mark-scheme entries ({})", meta.canonicalKey(), units.size(),
                units.stream().filter(QuestionUnit::isWholeQuestion).count(), markScheme.entries().size(), markScheme.layout());
        return new SegmentationResult(units, markScheme.entries(), markScheme.layout(), warnings);
    }

    List<QuestionUnit> segmentQuestions(String paperId, PaperDocument doc, SubjectProfile profile, String paperNumber,
                                        List<PipelineIssue> warnings) {
        List<LocatedLine> lines = doc.lines();
        boolean[] skip = skipped(lines, profile, paperCodePattern(paperNumber));
        Walk walk = new Walk(lines, skip, profile, warnings);
        walk.run();

        if (walk.questions.isEmpty()) {
            throw new SegmentationFailure("No question boundaries found in " + doc.pageCount() + " pages");
        }

        List<QuestionUnit> units = new ArrayList<>();
        for (Node q : walk.questions) {
            units.add(toUnit(paperId, doc, lines, skip, q, questionMarks(q)));
            for (Node p : q.children) {
                units.add(toUnit(paperId, doc, lines, skip, p, partMarks(p)));
                for (Node s : p.children) {
                    units.add(toUnit(paperId, doc, lines, skip, s, s.marks));
                }
            }
        }
        return units;
    }

    private boolean[] skipped(List<LocatedLine> lines, SubjectProfile profile, Pattern paperCode) {
        boolean[] skip = new boolean[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).text().trim();
            String lower = text.toLowerCase(Locale.ROOT);
            skip[i] = text.isEmpty()
                    || BARCODE.matcher(text).matches()
                    || profile.denyList().stream().anyMatch(lower::contains)
                    || (paperCode != null && paperCode.matcher(text).find());
        }
        return skip;
    }

    static Pattern paperCodePattern(String paperNumber) {
        if (paperNumber == null || paperNumber.isBlank()) return null;
        String hint = Pattern.quote(paperNumber.trim());
        boolean hasLetters = paperNumber.chars().anyMatch(Character::isLetter);
        String regex = hasLetters
                ? "^(?:paper\\s*(?:reference\\s*)?)?(?:[0-9A-Z]{3,5}\\s*/\\s*)?" + hint + "\\b"
                : "^paper\\s*(?:reference\\s*)?" + hint + "\\b";
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private Integer questionMarks(Node q) {
        if (q.fenceTotal != null) return q.fenceTotal;
        if (q.children.isEmpty()) return q.marks;
        Integer parts = sum(q.children.stream().map(this::partMarks).toList());
        return parts != null ? parts : q.marks;
    }

    private Integer partMarks(Node p) {
        if (p.marks != null) return p.marks;
        return sum(p.children.stream().map(s -> s.marks).toList());
    }

    private Integer sum(List<Integer> values) {
        if (values.stream().allMatch(Objects::isNull)) return null;
        return values.stream().filter(Objects::nonNull).mapToInt(Integer::intValue).sum();
    }

    private QuestionUnit toUnit(String paperId, PaperDocument doc, List<LocatedLine> lines, boolean[] skip, Node node, Integer marks) {
        List<LocatedLine> own = new ArrayList<>();
        for (int i = node.start; i < node.end; i++) {
            if (!skip[i]) own.add(lines.get(i));
        }
        List<PageRange> ranges = PageRegions.of(doc, own);
        StringBuilder text = new StringBuilder();
        for (LocatedLine line : own) {
            if (text.length() > 0) text.append('\n');
            text.append(line.text());
        }
        String excerpt = text.length() > MAX_TEXT ? text.substring(0, MAX_TEXT) : text.toString();
        boolean diagram = ranges.stream().anyMatch(r -> doc.page(r.pageIndex()).hasImage()) || DIAGRAM.matcher(excerpt).find();
        return new QuestionUnit(UUID.randomUUID().toString(), paperId, node.question, node.partCode(), ranges, excerpt, marks, diagram);
    }

    private static final class Walk {
        final List<LocatedLine> lines;
        final boolean[] skip;
        final SubjectProfile profile;
        final List<PipelineIssue> warnings;
        final List<Node> questions = new ArrayList<>();

        Node question, part, subPart;
        int currentNumber;
        char lastLetter;
        int lastRoman;
        int lastClosedEnd;

        Walk(List<LocatedLine> lines, boolean[] skip, SubjectProfile profile, List<PipelineIssue> warnings) {
            this.lines = lines;
            this.skip = skip;
            this.profile = profile;
            this.warnings = warnings;
        }

        void run() {
            for (int i = 0; i < lines.size(); i++) {
                if (skip[i]) continue;
                LocatedLine line = lines.get(i);
                String text = line.text().trim();

                Matcher fence = FENCE.matcher(text);
                if (fence.find()) {
                    onFence(i, Integer.parseInt(fence.group(1)), Integer.parseInt(fence.group(2)));
                    continue;
                }

                if (line.line().x() <= profile.leftMarginMax()) {
                    String rest = questionStart(i, text);
                    if (rest != null) {
                        if (!rest.isEmpty()) openPartFrom(rest, i);
                        applyMarks(text);
                        continue;
                    }
                }

                if (question != null && line.line().x() <= profile.leftMarginMax() + PART_INDENT && openPartFrom(text, i)) {
                    applyMarks(text);
                    continue;
                }

                if (question != null) applyMarks(text);
            }
            closeQuestion(lines.size());
        }

        private void onFence(int i, int number, int total) {
            if (question != null && Integer.parseInt(question.question) == number) {
                question.fenceTotal = total;
                closePart(i);
                closeQuestion(i + 1);
                return;
            }
            if (question != null) {
                warnings.add(new PipelineIssue(SEGMENTATION_WARNING,
                        "Fence for question " + number + " found while question " + question.question + " is open",
                        question.question, ""));
                closeQuestion(i + 1);
                if (number > currentNumber && profile.inQuestionRange(number)) currentNumber = number;
                return;
            }
            if (number > currentNumber && profile.inQuestionRange(number)) {
                int start = lastClosedEnd;
                while (start < i && skip[start]) start++;
                Node recovered = new Node(String.valueOf(number), null, null, start);
                recovered.end = i + 1;
                recovered.fenceTotal = total;
                questions.add(recovered);
                currentNumber = number;
                lastClosedEnd = i + 1;
                warnings.add(new PipelineIssue(SEGMENTATION_WARNING,
                        "Start of question " + number + " not detected; recovered from its total-marks line",
                        String.valueOf(number), ""));
                return;
            }
            warnings.add(PipelineIssue.paper(SEGMENTATION_WARNING, "Ignored stray total-marks line for question " + number));
        }

        private String questionStart(int i, String text) {
            for (Pattern pattern : profile.highPriorityPatterns()) {
                Matcher m = pattern.matcher(text);
                if (m.find() && accept(m.group(1))) {
                    openQuestion(Integer.parseInt(m.group(1)), i);
                    return text.substring(m.end(1)).trim();
                }
            }
            for (Pattern pattern : profile.lowPriorityPatterns()) {
                Matcher m = pattern.matcher(text);
                if (m.find() && accept(m.group(1)) && keywordFollows(i)) {
                    openQuestion(Integer.parseInt(m.group(1)), i);
                    return text.substring(m.end(1)).trim();
                }
            }
            return null;
        }

        private boolean accept(String digits) {
            int number = Integer.parseInt(digits);
            return profile.inQuestionRange(number) && number > currentNumber;
        }

        private boolean keywordFollows(int i) {
            int seen = 0;
            for (int j = i + 1; j < lines.size() && seen < profile.validationWindow(); j++) {
                if (skip[j]) continue;
                seen++;
                String lower = lines.get(j).text().toLowerCase(Locale.ROOT);
                if (profile.validationKeywords().stream().anyMatch(lower::contains)) return true;
            }
            return false;
        }

        private void openQuestion(int number, int i) {
            closeQuestion(i);
            question = new Node(String.valueOf(number), null, null, i);
            questions.add(question);
            currentNumber = number;
            lastLetter = 0;
            lastRoman = 0;
        }

        private boolean openPartFrom(String text, int i) {
            Matcher partMatcher = PART.matcher(text);
            if (partMatcher.matches()) {
                char letter = partMatcher.group(1).charAt(0);
                if (letter <= lastLetter) return false;
                closePart(i);
                part = new Node(question.question, partMatcher.group(1), null, i);
                question.children.add(part);
                lastLetter = letter;
                lastRoman = 0;
                if (partMatcher.group(2) != null) openSubPart(partMatcher.group(2), i);
                return true;
            }
            Matcher subMatcher = SUB_PART.matcher(text);
            if (part != null && subMatcher.matches()) {
                int roman = ROMANS.indexOf(subMatcher.group(1)) + 1;
                if (roman <= lastRoman) return false;
                openSubPart(subMatcher.group(1), i);
                return true;
            }
            return false;
        }

        private void openSubPart(String roman, int i) {
            closeSubPart(i);
            subPart = new Node(question.question, part.part, roman, i);
            part.children.add(subPart);
            lastRoman = ROMANS.indexOf(roman) + 1;
        }

        private void applyMarks(String text) {
            Matcher m = TRAILING_MARKS.matcher(text);
            if (!m.find()) return;
            int value = Integer.parseInt(m.group(1) != null ? m.group(1) : m.group(2));
            Node target = subPart != null ? subPart : part != null ? part : question;
            if (target != null) target.marks = target.marks == null ? value : target.marks + value;
        }

        private void closeSubPart(int end) {
            if (subPart == null) return;
            subPart.end = end;
            subPart = null;
        }

        private void closePart(int end) {
            closeSubPart(end);
            if (part == null) return;
            part.end = end;
            part = null;
        }

        private void closeQuestion(int end) {
            closePart(end);
            if (question == null) return;
            question.end = end;
            question = null;
            lastClosedEnd = end;
        }
    }

    private static final class Node {
        final String question;
        final String part;
        final String subPart;
        final int start;
        int end;
        Integer marks;
        Integer fenceTotal;
        final List<Node> children = new ArrayList<>();

        Node(String question, String part, String subPart, int start) {
            this.question = question;
            this.part = part;
            this.subPart = subPart;
            this.start = start;
        }

        String partCode() {
            if (part == null) return "";
            return subPart == null ? part : part + "(" + subPart + ")";
        }
    }

    public record SegmentationResult(List<QuestionUnit> units,
                                     List<MarkSchemeEntry> markSchemeEntries,
                                     Layout markSchemeLayout,
                                     List<PipelineIssue> warnings) {}
}
