package com.grademax.pipeline;

import com.grademax.pipeline.ExamPdfFixtures.PaperFixture;
import com.grademax.pipeline.assembly.WorksheetAssembler;
import com.grademax.pipeline.assembly.WorksheetModels.AssemblyResult;
import com.grademax.pipeline.assembly.WorksheetModels.WorksheetCriteria;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.MatchMethod;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.markscheme.MarkSchemeLinker.LinkResult;
import com.grademax.pipeline.repository.MarkSchemeLinkJdbcRepository;
import com.grademax.pipeline.repository.PaperJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository;
import com.grademax.pipeline.service.IngestionModels.IngestionRequest;
import com.grademax.pipeline.service.IngestionModels.MetadataHints;
import com.grademax.pipeline.service.IngestionModels.PaperResult;
import com.grademax.pipeline.service.IngestionModels.Status;
import com.grademax.pipeline.service.PaperIngestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.grademax.pipeline.ExamPdfFixtures.margin;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PaperIngestionServiceTest {
    @Autowired
    private PaperIngestionService service;
    @Autowired
    private PaperJdbcRepository papers;
    @Autowired
    private QuestionUnitJdbcRepository units;
    @Autowired
    private MarkSchemeLinkJdbcRepository links;
    @Autowired
    private WorksheetAssembler assembler;

    private static IngestionRequest request(PaperFixture fixture, int year) {
        return new IngestionRequest("4PH1_1P_Jun_" + year + ".pdf", fixture.questionPaper(),
                "4PH1_1P_MS_Jun_" + year + ".pdf", fixture.markScheme(), null);
    }

    @Test
    void twelveQuestionPaperYieldsTwelveLinkedQuestions() {
        PaperFixture fixture = ExamPdfFixtures.physicsPaper(12, 32, 0);
        assertEquals(32, fixture.totalPages());

        PaperResult result = service.ingest(request(fixture, 2019));

        assertEquals(Status.OK, result.status());
        assertEquals("Edexcel/IGCSE/4PH1/2019/June/1P", result.paper().metadata().canonicalKey());
        assertEquals(12, result.paper().totalQuestions());

        List<QuestionUnit> questions = result.units().stream().filter(QuestionUnit::isWholeQuestion).toList();
        assertEquals(12, questions.size());
        for (QuestionUnit question : questions) {
            MarkSchemeLink link = result.links().stream()
                    .filter(l -> l.questionUnitId().equals(question.getId())).findFirst().orElseThrow();
            assertTrue(link.confidence() > 0, "link confidence for " + question);
            assertEquals(MatchMethod.EXACT, link.matchMethod());
            assertEquals(question.getMarkValue(), link.pointTotal(), "mark agreement for " + question);
        }

        QuestionUnit first = questions.get(0);
        assertEquals(6, first.getMarkValue());
        assertEquals(3, first.pageCount());
        assertEquals(List.of(1, 2, 3), first.getPageRanges().stream().map(r -> r.pageIndex()).toList());
        assertEquals(5, questions.get(11).getMarkValue());
        assertEquals(2, questions.get(11).pageCount());
    }

    @Test
    void everyUnitIsUniqueAndClassifiedWithinRange() {
        PaperResult result = service.ingest(request(ExamPdfFixtures.physicsPaper(8, 20, 1), 2020));
        assertEquals(Status.OK, result.status());

        Set<String> keys = new HashSet<>();
        for (QuestionUnit unit : result.units()) {
            assertTrue(keys.add(unit.getQuestionNumber() + "|" + unit.getPartCode()), "duplicate " + unit);
            assertNotNull(unit.getTopicCode());
            assertTrue(unit.getConfidence() >= 0 && unit.getConfidence() <= 1);
        }
        assertEquals(8 + 8 * 2 + 3, result.units().size());

        QuestionUnit refraction = result.units().stream()
                .filter(u -> u.getQuestionNumber().equals("1") && u.getPartCode().equals("b")).findFirst().orElseThrow();
        assertTrue(refraction.isHasDiagram());
        assertEquals("3", refraction.getTopicCode());
        assertTrue(refraction.isReviewRequired());
        assertTrue(result.issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.LOW_CONFIDENCE_CLASSIFICATION)));
    }

    @Test
    void reingestionReplacesUnitsBumpsRevisionAndMarksWorksheetsStale() {
        PaperFixture fixture = ExamPdfFixtures.physicsPaper(8, 17, 0);
        PaperResult first = service.ingest(request(fixture, 2041));
        assertEquals(1, first.paper().revision());

        AssemblyResult worksheet = assembler.assemble(new WorksheetCriteria(Set.of(), 2041, 2041, null, 5, false, null, true, null));
        assertEquals(5, worksheet.selectedUnits().size());

        PaperResult second = service.ingest(request(fixture, 2041));
        assertEquals(Status.OK, second.status());
        assertEquals(first.paper().id(), second.paper().id());
        assertEquals(2, second.paper().revision());
        assertEquals(1, second.staleWorksheets());
        assertEquals(first.units().size(), units.findByPaper(first.paper().id()).size());
        assertEquals(first.units().size(), links.findByPaper(first.paper().id()).size());
        assertTrue(assembler.findById(worksheet.worksheet().id()).stale());

        List<String> structure = first.units().stream().map(u -> u.getQuestionNumber() + u.getPartCode() + ":" + u.getMarkValue()).toList();
        assertEquals(structure, units.findByPaper(first.paper().id()).stream()
                .map(u -> u.getQuestionNumber() + u.getPartCode() + ":" + u.getMarkValue()).toList());
    }

    @Test
    void paperWithoutQuestionBoundariesFailsAndPersistsNothing() {
        byte[] prose = ExamPdfFixtures.singlePage(margin("Instructions"), margin("Use black ink or ball-point pen."),
                margin("Information for candidates"));
        PaperResult result = service.ingest(new IngestionRequest("4PH1_2P_Jan_2042.pdf", prose, null, null, null));

        assertEquals(Status.FAILED, result.status());
        assertNull(result.paper());
        assertTrue(result.issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.SEGMENTATION_FAILURE)));
        assertTrue(papers.findByCanonicalKey("Edexcel/IGCSE/4PH1/2042/January/2P").isEmpty());
    }

    @Test
    void unreadableDocumentFails() {
        byte[] notPdf = "plain text, not a PDF".getBytes(StandardCharsets.UTF_8);
        PaperResult result = service.ingest(new IngestionRequest("scan.pdf", notPdf, null, null,
                new MetadataHints("Edexcel", "IGCSE", "4PH1", 2043, "June", "2P")));

        assertEquals(Status.FAILED, result.status());
        assertTrue(result.issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.DOCUMENT_UNREADABLE)));
    }

    @Test
    void missingMarkSchemeLeavesUnitsUnmatchedAndRelinkRecovers() {
        PaperFixture fixture = ExamPdfFixtures.physicsPaper(8, 17, 2);
        PaperResult result = service.ingest(new IngestionRequest("4PH1_2P_May_2044.pdf", fixture.questionPaper(), null, null, null));

        assertEquals(Status.OK, result.status());
        assertTrue(result.links().stream().noneMatch(MarkSchemeLink::matched));
        assertEquals(result.units().size(), result.issues().stream()
                .filter(i -> i.code().equals(PipelineIssue.Codes.LINKING_UNMATCHED)).count());

        LinkResult relinked = service.relink(result.paper().id());
        assertTrue(relinked.links().stream().noneMatch(MarkSchemeLink::matched));
    }

    @Test
    void ingestAllReturnsOneResultPerRequest() {
        List<IngestionRequest> requests = List.of(
                request(ExamPdfFixtures.physicsPaper(8, 17, 3), 2045),
                new IngestionRequest("4PH1_1P_Jun_2046.pdf", new byte[]{1, 2, 3}, null, null, null),
                request(ExamPdfFixtures.physicsPaper(9, 19, 4), 2047),
                new IngestionRequest("notes.pdf", new byte[]{1}, null, null, null));

        List<PaperResult> results = service.ingestAll(requests);

        assertEquals(4, results.size());
        assertEquals(Status.OK, results.get(0).status());
        assertEquals(Status.FAILED, results.get(1).status());
        assertEquals(Status.OK, results.get(2).status());
        assertEquals(9, results.get(2).paper().totalQuestions());
        assertEquals(Status.FAILED, results.get(3).status());
        assertTrue(results.get(3).issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.INGESTION_ERROR)));
    }

    @Test
    void concurrentIngestionOfTheSameNewPaperKeepsOneRow() {
        PaperFixture fixture = ExamPdfFixtures.physicsPaper(8, 17, 5);
        List<PaperResult> results = service.ingestAll(List.of(request(fixture, 2051), request(fixture, 2051)));

        assertTrue(results.stream().allMatch(r -> r.status() == Status.OK), () -> results.toString());
        String paperId = results.get(0).paper().id();
        assertEquals(paperId, results.get(1).paper().id());
        assertEquals(Set.of(1, 2), results.stream().map(r -> r.paper().revision()).collect(Collectors.toSet()));
        assertEquals(2, papers.findByCanonicalKey("Edexcel/IGCSE/4PH1/2051/June/1P").orElseThrow().revision());
        assertEquals(results.get(0).units().size(), units.findByPaper(paperId).size());
        assertTrue(results.stream().flatMap(r -> r.units().stream()).allMatch(u -> u.getPaperId().equals(paperId)));
    }
}
