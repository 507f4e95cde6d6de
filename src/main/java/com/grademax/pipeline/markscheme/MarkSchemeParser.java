package com.grademax.pipeline.markscheme;

import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.document.DocumentModels.LocatedLine;
import com.grademax.pipeline.document.DocumentModels.PaperDocument;
import com.grademax.pipeline.document.PageRegions;
import com.grademax.pipeline.domain.DomainModels.MarkPoint;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.DomainModels.Rect;
import com.grademax.pipeline.markscheme.MarkSchemeModels.Layout;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeParse;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class MarkSchemeParser {
    private static final Pattern KEY_ROW = Pattern.compile(
            "^(?:Q(?:uestion)?\\.?\\s*)?(\\d{1,2})(?:\\s*\\(([a-h])\\)|([a-h])(?![a-z]))?(?:\\s*\\(([ivx]{1,4})\\))?(?![\\d.,/])\\s*(:)?\\s*(.*)$");
    private static final Pattern PART_ROW = Pattern.compile("^\\(([a-h])\\)\\s*(?:\\(([ivx]{1,4})\\))?\\s*(.*)$");
    private static final Pattern SUB_ROW = Pattern.compile("^\\(([ivx]{1,4})\\)\\s*(.*)$");
    private static final Pattern TOTAL = Pattern.compile("Total\\s+for\\s+Question\\s+(\\d{1,2})\\s*[=:]\\s*(\\d{1,3})", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARK_CODE = Pattern.compile("\\b([MABC])(\\d)\\b");
    private static final Pattern MARK_COLUMN = Pattern.compile("\\b[MABC]\\d\\s+(\\d{1,2})$");
    private static final Pattern BRACKET_MARKS = Pattern.compile("[\\[(](\\d{1,2})(?:\\s*marks?)?[])]\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BULLET = Pattern.compile("^(?:[•●▪\\-*]|o\\s)\\s*(.*)$");
    private static final Pattern PAGE_NOISE = Pattern.compile("^(?:Page\\s+\\d+.*|\\*[A-Z0-9]+\\*|PMT)$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> HEADER_WORDS = Set.of("question", "number", "answer", "answers", "notes",
            "marks", "mark", "additional", "guidance", "acceptable", "mark scheme", "question number");
    private static final double RIGHT_NOISE_X = 200;

    public MarkSchemeParse parse(PaperDocument document, SubjectProfile profile) {
        if (document == null) return MarkSchemeParse.empty();

        List<Builder> builders = new ArrayList<>();
        Map<String, Integer> questionTotals = new HashMap<>();
        Map<Layout, Integer> layoutVotes = new EnumMap<>(Layout.class);

        Builder current = null;
        int currentQuestion = 0;

        for (LocatedLine line : document.lines()) {
            String text = line.text().trim();
            if (text.isEmpty() || isNoise(line, text, profile)) continue;

            Matcher total = TOTAL.matcher(text);
            if (total.find()) {
                questionTotals.merge(total.group(1), Integer.parseInt(total.group(2)), (a, b) -> b);
                current = null;
                continue;
            }

            boolean atMargin = line.line().x() <= profile.leftMarginMax();
            Matcher key = KEY_ROW.matcher(text);
            if (atMargin && key.matches()) {
                int number = Integer.parseInt(key.group(1));
                boolean acceptable = profile.inQuestionRange(number) && number >= currentQuestion;
                String part = key.group(2) != null ? key.group(2) : key.group(3);
                String sub = key.group(4);
                String rest = key.group(6);
                if (acceptable && (part != null || number > currentQuestion || rest.isEmpty())) {
                    currentQuestion = number;
                    current = open(builders, String.valueOf(number), part, sub);
                    layoutVotes.merge(layoutOf(text, key.group(5) != null, rest), 1, Integer::sum);
                    current.append(rest, line);
                    continue;
                }
            }

            if (current != null && atMargin) {
                Matcher partRow = PART_ROW.matcher(text);
                if (partRow.matches()) {
                    current = open(builders, current.question, partRow.group(1), partRow.group(2));
                    current.append(partRow.group(3), line);
                    continue;
                }
            }
            if (current != null) {
                Matcher subRow = SUB_ROW.matcher(text);
                if (subRow.matches() && current.part != null) {
                    current = open(builders, current.question, current.part, subRow.group(1));
                    current.append(subRow.group(2), line);
                    continue;
                }
                current.append(text, line);
            }
        }

        Layout layout = layoutVotes.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(Layout.TABULAR);
        return new MarkSchemeParse(aggregate(document, builders, questionTotals), layout);
    }

    private boolean isNoise(LocatedLine line, String text, SubjectProfile profile) {
        if (PAGE_NOISE.matcher(text).matches()) return true;
        if (text.matches("\\d{1,3}") && line.line().x() > RIGHT_NOISE_X) return true;
        String lower = text.toLowerCase(Locale.ROOT);
        if (profile.denyList().stream().anyMatch(lower::contains)) return true;
        return Arrays.stream(lower.split("\\s+")).allMatch(HEADER_WORDS::contains);
    }

    private Layout layoutOf(String text, boolean colon, String rest) {
        if (rest.isEmpty()) return Layout.INDENTED;
        if (colon || text.startsWith("Q") || BRACKET_MARKS.matcher(rest).find()) return Layout.INLINE;
        return Layout.TABULAR;
    }

    private Builder open(List<Builder> builders, String question, String part, String sub) {
        String partCode = part == null ? "" : part + (sub == null ? "" : "(" + sub + ")");
        for (Builder b : builders) {
            if (b.question.equals(question) && b.partCode().equals(partCode)) return b;
        }
        Builder builder = new Builder(question, part, sub);
        builders.add(builder);
        return builder;
    }

    private List<MarkSchemeEntry> aggregate(PaperDocument document, List<Builder> builders, Map<String, Integer> totals) {
        Map<String, Builder> byKey = new LinkedHashMap<>();
        builders.forEach(b -> byKey.put(b.question + b.partCode(), b));

        // parents that only exist through their children
        for (Builder b : builders) {
            if (b.sub != null) byKey.computeIfAbsent(b.question + b.part, k -> new Builder(b.question, b.part, null));
            byKey.computeIfAbsent(b.question, k -> new Builder(b.question, null, null));
        }

        Map<String, MarkSchemeEntry> built = new HashMap<>();
        List<MarkSchemeEntry> entries = new ArrayList<>();
        List<Builder> ordered = byKey.values().stream()
                .sorted(Comparator.comparingInt((Builder b) -> Integer.parseInt(b.question))
                        .thenComparing(Builder::partCode))
                .toList();

        // children before parents so parent aggregates can reuse them
        List<Builder> bottomUp = new ArrayList<>(ordered);
        bottomUp.sort(Comparator.comparingInt((Builder b) -> b.rank()).reversed());
        for (Builder b : bottomUp) {
            List<MarkSchemeEntry> children = ordered.stream()
                    .filter(c -> c.isChildOf(b))
                    .map(c -> built.get(c.question + c.partCode()))
                    .filter(Objects::nonNull)
                    .toList();
            Integer explicit = b.sub == null && b.part == null ? totals.getOrDefault(b.question, b.explicitMarks()) : b.explicitMarks();
            built.put(b.question + b.partCode(), b.build(document, children, explicit));
        }
        ordered.forEach(b -> entries.add(built.get(b.question + b.partCode())));
        return List.copyOf(entries);
    }

    static List<MarkPoint> markPoints(String content, Integer explicitMarks) {
        List<MarkPoint> points = new ArrayList<>();
        String flat = content.replace('\n', ' ').trim();
        Matcher code = MARK_CODE.matcher(flat);
        int from = 0;
        while (code.find()) {
            String before = flat.substring(from, code.start()).trim();
            String label = code.group(1) + code.group(2);
            points.add(new MarkPoint(before.isEmpty() ? label : label + ": " + before, Integer.parseInt(code.group(2))));
            from = code.end();
        }
        if (!points.isEmpty()) {
            String tail = flat.substring(from).trim();
            if (!tail.isEmpty()) {
                MarkPoint last = points.remove(points.size() - 1);
                points.add(new MarkPoint(last.text() + " " + tail, last.value()));
            }
            return points;
        }

        for (String raw : content.split("\n")) {
            Matcher bullet = BULLET.matcher(raw.trim());
            if (!bullet.matches()) continue;
            String text = bullet.group(1).trim();
            int value = 1;
            Matcher marks = BRACKET_MARKS.matcher(text);
            if (marks.find()) {
                value = Integer.parseInt(marks.group(1));
                text = text.substring(0, marks.start()).trim();
            }
            if (!text.isEmpty()) points.add(new MarkPoint(text, value));
        }
        if (!points.isEmpty()) return points;

        if (!flat.isEmpty()) points.add(new MarkPoint(flat, explicitMarks == null ? 1 : explicitMarks));
        return points;
    }

    private static final class Builder {
        final String question;
        final String part;
        final String sub;
        final StringBuilder content = new StringBuilder();
        final List<LocatedLine> lines = new ArrayList<>();
        Integer marks;

        Builder(String question, String part, String sub) {
            this.question = question;
            this.part = part;
            this.sub = sub;
        }

        String partCode() {
            if (part == null) return "";
            return sub == null ? part : part + "(" + sub + ")";
        }

        int rank() {
            return part == null ? 0 : sub == null ? 1 : 2;
        }

        boolean isChildOf(Builder parent) {
            if (!question.equals(parent.question) || rank() != parent.rank() + 1) return false;
            return parent.part == null || parent.part.equals(part);
        }

        void append(String text, LocatedLine line) {
            lines.add(line);
            if (text == null || text.isBlank()) return;
            String value = text.trim();
            Matcher column = MARK_COLUMN.matcher(value);
            Matcher bracket = BRACKET_MARKS.matcher(value);
            if (column.find()) {
                marks = add(marks, Integer.parseInt(column.group(1)));
                value = value.substring(0, column.start(1)).trim();
            } else if (bracket.find() && !BULLET.matcher(value).matches()) {
                marks = add(marks, Integer.parseInt(bracket.group(1)));
                value = value.substring(0, bracket.start()).trim();
            }
            if (value.isEmpty()) return;
            if (content.length() > 0) content.append('\n');
            content.append(value);
        }

        Integer explicitMarks() {
            return marks;
        }

        private static Integer add(Integer a, int b) {
            return a == null ? b : a + b;
        }

        MarkSchemeEntry build(PaperDocument document, List<MarkSchemeEntry> children, Integer explicit) {
            String own = content.toString();
            List<MarkPoint> points = new ArrayList<>(own.isBlank() ? List.of() : markPoints(own, children.isEmpty() ? explicit : null));
            List<LocatedLine> allLines = new ArrayList<>(lines);
            StringBuilder raw = new StringBuilder(own);
            for (MarkSchemeEntry child : children) {
                points.addAll(child.markPoints());
                if (raw.length() > 0 && !child.rawText().isEmpty()) raw.append('\n');
                raw.append(child.rawText());
            }
            Integer resolved = explicit;
            if (resolved == null && !children.isEmpty() && children.stream().allMatch(c -> c.marks() != null)) {
                resolved = children.stream().mapToInt(MarkSchemeEntry::marks).sum();
            }
            if (resolved == null && !points.isEmpty()) {
                resolved = points.stream().mapToInt(MarkPoint::value).sum();
            }
            List<PageRange> pages = PageRegions.of(document, allLines);
            if (!children.isEmpty()) pages = mergePages(pages, children);
            return new MarkSchemeEntry(question, partCode(), resolved, List.copyOf(points), raw.toString(), pages);
        }

        private List<PageRange> mergePages(List<PageRange> own, List<MarkSchemeEntry> children) {
            TreeMap<Integer, PageRange> byPage = new TreeMap<>();
            own.forEach(p -> byPage.put(p.pageIndex(), p));
            children.forEach(c -> c.pageRanges().forEach(p -> byPage.merge(p.pageIndex(), p, Builder::union)));
            return List.copyOf(byPage.values());
        }

        private static PageRange union(PageRange a, PageRange b) {
            if (a.region() == null || b.region() == null) return new PageRange(a.pageIndex(), null);
            var r1 = a.region();
            var r2 = b.region();
            double x = Math.min(r1.x(), r2.x());
            double y = Math.min(r1.y(), r2.y());
            double right = Math.max(r1.x() + r1.width(), r2.x() + r2.width());
            double bottom = Math.max(r1.y() + r1.height(), r2.y() + r2.height());
            return new PageRange(a.pageIndex(), new Rect(x, y, right - x, bottom - y));
        }
    }
}
