package com.grademax.pipeline;

import com.grademax.pipeline.domain.DomainModels.MarkPoint;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.MatchMethod;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.markscheme.CueExtractor;
import com.grademax.pipeline.markscheme.MarkSchemeLinker;
import com.grademax.pipeline.markscheme.MarkSchemeLinker.LinkResult;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkSchemeLinkerTest {
    private final MarkSchemeLinker linker = new MarkSchemeLinker(new CueExtractor());

    private static QuestionUnit unit(String number, String part, Integer marks, String text) {
        return new QuestionUnit(number + part, "paper", number, part, List.of(new PageRange(1, null)), text, marks, false);
    }

    private static MarkSchemeEntry entry(String number, String part, Integer marks, String text) {
        return new MarkSchemeEntry(number, part, marks, List.of(new MarkPoint(text, marks == null ? 1 : marks)), text,
                List.of(new PageRange(0, null)));
    }

    private static MarkSchemeLink linkOf(LinkResult result, String unitId) {
        return result.links().stream().filter(l -> l.questionUnitId().equals(unitId)).findFirst().orElseThrow();
    }

    @Test
    void exactKeyWithAgreeingMarksAndSharedCues() {
        LinkResult result = linker.link(
                List.of(unit("1", "a", 2, "Calculate the acceleration of the trolley in m/s2.")),
                List.of(entry("1", "a", 2, "acceleration = change in velocity / time, 2 m/s2")));

        MarkSchemeLink link = linkOf(result, "1a");
        assertEquals(MatchMethod.EXACT, link.matchMethod());
        assertTrue(link.confidence() >= 0.7 && link.confidence() <= 1.0);
        assertEquals(List.of(new PageRange(0, null)), link.markSchemePages());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void fuzzyKeyIgnoresLeadingZerosAndBrackets() {
        LinkResult result = linker.link(
                List.of(unit("01", "b(ii)", 3, "Explain the result.")),
                List.of(entry("1", "bii", 3, "the current falls")));

        MarkSchemeLink link = linkOf(result, "01b(ii)");
        assertEquals(MatchMethod.FUZZY, link.matchMethod());
        assertEquals(0.4 * 0.5 + 0.3, link.confidence(), 1e-9);
    }

    @Test
    void fallsBackToMarksWithinTheSameQuestion() {
        LinkResult result = linker.link(
                List.of(unit("2", "c", 3, "Describe the motion.")),
                List.of(entry("2", "d", 3, "constant speed then decelerates"), entry("3", "c", 3, "other question")));

        MarkSchemeLink link = linkOf(result, "2c");
        assertEquals(MatchMethod.MARKS_ONLY, link.matchMethod());
        assertEquals("constant speed then decelerates", link.rawSnippet());
    }

    @Test
    void unmatchedUnitGetsZeroConfidenceAndAnIssue() {
        LinkResult result = linker.link(
                List.of(unit("5", "", 4, "A question with no answer row.")),
                List.of(entry("1", "a", 2, "newton")));

        MarkSchemeLink link = linkOf(result, "5");
        assertEquals(MatchMethod.UNMATCHED, link.matchMethod());
        assertEquals(0.0, link.confidence());
        assertFalse(link.matched());
        assertEquals(1, result.issues().size());
        assertEquals(PipelineIssue.Codes.LINKING_UNMATCHED, result.issues().get(0).code());
        assertEquals("5", result.issues().get(0).questionNumber());
    }

    @Test
    void anEntryIsClaimedByOneUnitOnly() {
        LinkResult result = linker.link(
                List.of(unit("4", "a", 2, "first"), unit("04", "a", 2, "second")),
                List.of(entry("4", "a", 2, "only answer")));

        assertEquals(MatchMethod.EXACT, linkOf(result, "4a").matchMethod());
        assertEquals(MatchMethod.UNMATCHED, linkOf(result, "04a").matchMethod());
    }

    @Test
    void markAgreementDecaysWithDifference() {
        LinkResult result = linker.link(
                List.of(unit("6", "", 5, "x"), unit("7", "", 7, "y"), unit("8", "", null, "z")),
                List.of(entry("6", "", 4, "p"), entry("7", "", 4, "q"), entry("8", "", 4, "r")));

        assertEquals(0.4 + 0.3 * 0.5, linkOf(result, "6").confidence(), 1e-9);
        assertEquals(0.4, linkOf(result, "7").confidence(), 1e-9);
        assertEquals(0.4, linkOf(result, "8").confidence(), 1e-9);
    }
}
