package com.grademax.pipeline;

import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfiles;
import com.grademax.pipeline.document.PdfDocumentReader;
import com.grademax.pipeline.domain.DomainModels.MarkPoint;
import com.grademax.pipeline.markscheme.MarkSchemeModels.Layout;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeParse;
import com.grademax.pipeline.markscheme.MarkSchemeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.grademax.pipeline.ExamPdfFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MarkSchemeParserTest {
    @Autowired
    private MarkSchemeParser parser;
    @Autowired
    private PdfDocumentReader reader;
    @Autowired
    private SubjectProfiles profiles;

    private SubjectProfile physics;

    @BeforeEach
    void setUp() {
        physics = profiles.forSubject("4PH1");
    }

    private MarkSchemeParse parse(byte[] pdf) {
        return parser.parse(reader.read(pdf), physics);
    }

    private static MarkSchemeEntry entry(MarkSchemeParse parse, String key) {
        return parse.entries().stream().filter(e -> e.key().equals(key)).findFirst()
                .orElseThrow(() -> new AssertionError("missing entry " + key));
    }

    @Test
    void parsesTabularRowsAndSynthesizesParents() {
        MarkSchemeParse parse = parse(singlePage(
                margin("Question number Answer Notes Marks"),
                margin("1(a) newton B1 1"),
                margin("1(b)(i) speed = distance / time M1 A1 2"),
                margin("1(b)(ii) friction acts against the motion M1 M1 A1 3"),
                margin("Total for Question 1 = 6 marks"),
                at(520, "14")));

        assertEquals(Layout.TABULAR, parse.layout());
        assertEquals(List.of("1", "1a", "1b", "1b(i)", "1b(ii)"), parse.entries().stream().map(MarkSchemeEntry::key).toList());
        assertEquals(6, entry(parse, "1").marks());
        assertEquals(5, entry(parse, "1b").marks());
        assertEquals(3, entry(parse, "1b(ii)").marks());

        List<MarkPoint> points = entry(parse, "1b(i)").markPoints();
        assertEquals(2, points.size());
        assertEquals("M1: speed = distance / time", points.get(0).text());
        assertEquals(6, entry(parse, "1").markPoints().stream().mapToInt(MarkPoint::value).sum());
        assertTrue(entry(parse, "1").rawText().contains("friction acts against the motion"));
    }

    @Test
    void parsesIndentedLayoutWithBullets() {
        MarkSchemeParse parse = parse(singlePage(
                margin("2"),
                margin("(a) wavelength decreases (1)"),
                margin("(b)"),
                at(90, "- light slows down in glass"),
                at(90, "- bends towards the normal"),
                margin("3"),
                margin("(a) half-life is the time for half the nuclei to decay (2)")));

        assertEquals(Layout.INDENTED, parse.layout());
        assertEquals(1, entry(parse, "2a").marks());
        MarkSchemeEntry bullets = entry(parse, "2b");
        assertEquals(List.of("light slows down in glass", "bends towards the normal"),
                bullets.markPoints().stream().map(MarkPoint::text).toList());
        assertEquals(2, bullets.marks());
        assertEquals(3, entry(parse, "2").marks());
        assertEquals(2, entry(parse, "3a").marks());
    }

    @Test
    void parsesInlineLayout() {
        MarkSchemeParse parse = parse(singlePage(
                margin("Q1a: 4.5 N [1]"),
                margin("Q1b: work done = force x distance [2]"),
                margin("Q2: energy is conserved [3]")));

        assertEquals(Layout.INLINE, parse.layout());
        assertEquals(1, entry(parse, "1a").marks());
        assertEquals(2, entry(parse, "1b").marks());
        assertEquals(3, entry(parse, "1").marks());
        assertEquals(3, entry(parse, "2").marks());
        assertEquals("4.5 N", entry(parse, "1a").markPoints().get(0).text());
    }

    @Test
    void entryPagesCoverEveryPageTheAnswerUses() {
        MarkSchemeParse parse = parse(pdf(List.of(
                List.of(margin("1(a) newton B1 1")),
                List.of(margin("1(b) mass x acceleration M1 A1 2"), margin("Total for Question 1 = 3 marks")))));

        assertEquals(List.of(0, 1), entry(parse, "1").pageRanges().stream().map(r -> r.pageIndex()).toList());
        assertEquals(1, entry(parse, "1b").pageRanges().get(0).pageIndex());
    }

    @Test
    void nullDocumentGivesNoEntries() {
        assertTrue(parser.parse(null, physics).entries().isEmpty());
    }
}
