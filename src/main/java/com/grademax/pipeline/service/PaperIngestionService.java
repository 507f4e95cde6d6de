package com.grademax.pipeline.service;

import com.grademax.pipeline.classification.ClassificationContext;
import com.grademax.pipeline.classification.ClassificationContextFactory;
import com.grademax.pipeline.classification.ClassificationModels.ClassificationReport;
import com.grademax.pipeline.classification.TopicClassifier;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfiles;
import com.grademax.pipeline.document.DocumentModels.PaperDocument;
import com.grademax.pipeline.document.PdfDocumentReader;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.Paper;
import com.grademax.pipeline.domain.DomainModels.PaperMetadata;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.DocumentReadException;
import com.grademax.pipeline.exception.NotFoundException;
import com.grademax.pipeline.exception.SegmentationFailure;
import com.grademax.pipeline.markscheme.MarkSchemeLinker;
import com.grademax.pipeline.markscheme.MarkSchemeLinker.LinkResult;
import com.grademax.pipeline.markscheme.MarkSchemeModels.MarkSchemeEntry;
import com.grademax.pipeline.markscheme.MarkSchemeParser;
import com.grademax.pipeline.repository.MarkSchemeLinkJdbcRepository;
import com.grademax.pipeline.repository.PaperJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository;
import com.grademax.pipeline.repository.WorksheetJdbcRepository;
import com.grademax.pipeline.segmentation.QuestionSegmenter;
import com.grademax.pipeline.segmentation.QuestionSegmenter.SegmentationResult;
import com.grademax.pipeline.service.IngestionModels.IngestionRequest;
import com.grademax.pipeline.service.IngestionModels.PaperResult;
import com.grademax.pipeline.service.IngestionModels.Status;
import com.grademax.pipeline.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.grademax.pipeline.domain.PipelineIssue.Codes.DOCUMENT_UNREADABLE;
import static com.grademax.pipeline.domain.PipelineIssue.Codes.INGESTION_ERROR;
import static com.grademax.pipeline.domain.PipelineIssue.Codes.SEGMENTATION_FAILURE;

@Service
public class PaperIngestionService {
    private static final Logger log = LoggerFactory.getLogger(PaperIngestionService.class);

    private final PdfDocumentReader reader;
    private final QuestionSegmenter segmenter;
    private final MarkSchemeParser markSchemeParser;
    private final MarkSchemeLinker linker;
    private final TopicClassifier classifier;
    private final SubjectProfiles profiles;
    private final MetadataDetector metadataDetector;
    private final ArtifactStore artifactStore;
    private final PaperJdbcRepository paperRepository;
    private final QuestionUnitJdbcRepository unitRepository;
    private final MarkSchemeLinkJdbcRepository linkRepository;
    private final WorksheetJdbcRepository worksheetRepository;
    private final TransactionTemplate transactionTemplate;
    private final ExecutorService ingestionExecutor;
    private final ClassificationContextFactory contextFactory;

    public PaperIngestionService(PdfDocumentReader reader,
                                 QuestionSegmenter segmenter,
                                 MarkSchemeParser markSchemeParser,
                                 MarkSchemeLinker linker,
                                 TopicClassifier classifier,
                                 SubjectProfiles profiles,
                                 MetadataDetector metadataDetector,
                                 ArtifactStore artifactStore,
                                 PaperJdbcRepository paperRepository,
                                 QuestionUnitJdbcRepository unitRepository,
                                 MarkSchemeLinkJdbcRepository linkRepository,
                                 WorksheetJdbcRepository worksheetRepository,
                                 TransactionTemplate transactionTemplate,
                                 ExecutorService ingestionExecutor,
                                 ClassificationContextFactory contextFactory) {
        this.reader = reader;
        this.segmenter = segmenter;
        this.markSchemeParser = markSchemeParser;
        this.linker = linker;
        this.classifier = classifier;
        this.profiles = profiles;
        this.metadataDetector = metadataDetector;
        this.artifactStore = artifactStore;
        this.paperRepository = paperRepository;
        this.unitRepository = unitRepository;
        this.linkRepository = linkRepository;
        this.worksheetRepository = worksheetRepository;
        this.transactionTemplate = transactionTemplate;
        this.ingestionExecutor = ingestionExecutor;
        this.contextFactory = contextFactory;
    }

    public PaperResult ingest(IngestionRequest request) {
        return ingest(request, contextFactory.create());
    }

    public PaperResult ingest(IngestionRequest request, ClassificationContext context) {
        if (request.questionPaper() == null || request.questionPaper().length == 0) {
            throw new IllegalArgumentException("questionPaper is required");
        }
        PaperMetadata meta = metadataDetector.resolve(request.questionPaperName(), request.hints());
        List<PipelineIssue> issues = new ArrayList<>();

        Optional<Paper> previous = paperRepository.findByCanonicalKey(meta.canonicalKey());
        String paperId = previous.map(Paper::id).orElseGet(() -> UUID.randomUUID().toString());

        SegmentationResult segmentation;
        try {
            PaperDocument questionDoc = reader.read(request.questionPaper());
            PaperDocument markSchemeDoc = hasMarkScheme(request) ? reader.read(request.markScheme()) : null;
            segmentation = segmenter.segment(paperId, questionDoc, markSchemeDoc, meta);
        } catch (SegmentationFailure e) {
            log.warn("Paper {} not ingested: {}", meta.canonicalKey(), e.getMessage());
            issues.add(PipelineIssue.paper(SEGMENTATION_FAILURE, e.getMessage()));
            return PaperResult.failed(issues);
        } catch (DocumentReadException e) {
            log.warn("Paper {} not ingested: {}", meta.canonicalKey(), e.getMessage());
            issues.add(PipelineIssue.paper(DOCUMENT_UNREADABLE, e.getMessage()));
            return PaperResult.failed(issues);
        }
        issues.addAll(segmentation.warnings());

        List<QuestionUnit> units = segmentation.units();
        LinkResult linked = linker.link(units, segmentation.markSchemeEntries());
        issues.addAll(linked.issues());

        Map<String, MarkSchemeLink> linksByUnit = linked.links().stream()
                .collect(Collectors.toMap(MarkSchemeLink::questionUnitId, Function.identity()));
        ClassificationReport report = classifier.classifyAll(units, linksByUnit, profiles.forSubject(meta.subjectCode()), context);
        issues.addAll(report.issues());

        String questionPaperUri = artifactStore.put("papers", request.questionPaper());
        String markSchemeUri = hasMarkScheme(request) ? artifactStore.put("markschemes", request.markScheme()) : null;
        int totalQuestions = (int) units.stream().filter(QuestionUnit::isWholeQuestion).count();
        Paper draft = new Paper(paperId, meta, questionPaperUri, markSchemeUri, totalQuestions, 1, Instant.now());

        Persisted persisted;
        try {
            persisted = persist(draft, units, linked.links());
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            // another ingestion of the same paper committed first; the second attempt revises its row
            log.debug("Paper {} inserted concurrently, retrying as a revision", meta.canonicalKey());
            persisted = persist(draft, units, linked.links());
        }
        Paper paper = persisted.paper();

        log.info("Paper {} ingested (revision {}): {} units, {} linked, keyword={}, external={}, fallback={}, review={}, stale worksheets={}",
                meta.canonicalKey(), paper.revision(), units.size(),
                linked.links().stream().filter(MarkSchemeLink::matched).count(),
                report.keyword(), report.external(), report.fallback(), report.reviewRequired(), persisted.staleWorksheets());
        return new PaperResult(paper, persisted.units(), linked.links(), List.copyOf(issues), Status.OK, persisted.staleWorksheets());
    }

    private Persisted persist(Paper draft, List<QuestionUnit> units, List<MarkSchemeLink> links) {
        return transactionTemplate.execute(status -> {
            Optional<Paper> existing = paperRepository.lockByCanonicalKey(draft.metadata().canonicalKey());
            String id = existing.map(Paper::id).orElse(draft.id());
            List<QuestionUnit> stored = id.equals(draft.id()) ? units : units.stream().map(u -> u.withPaperId(id)).toList();
            Paper paper = new Paper(id, draft.metadata(), draft.questionPaperUri(), draft.markSchemeUri(),
                    draft.totalQuestions(), existing.map(p -> p.revision() + 1).orElse(1), draft.ingestedAt());

            paperRepository.upsert(paper);
            unitRepository.replaceForPaper(id, stored);
            linkRepository.replaceForPaper(id, links);
            int stale = existing.isPresent() ? worksheetRepository.markStaleForPaper(id) : 0;
            return new Persisted(paper, stored, stale);
        });
    }

    public List<PaperResult> ingestAll(List<IngestionRequest> requests) {
        List<CompletableFuture<PaperResult>> futures = requests.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> ingestQuietly(r), ingestionExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private PaperResult ingestQuietly(IngestionRequest request) {
        try {
            return ingest(request);
        } catch (RuntimeException e) {
            log.error("Ingestion of {} failed", request.questionPaperName(), e);
            return PaperResult.failed(List.of(PipelineIssue.paper(INGESTION_ERROR,
                    request.questionPaperName() + ": " + e.getMessage())));
        }
    }

    public LinkResult relink(String paperId) {
        Paper paper = paperRepository.findById(paperId)
                .orElseThrow(() -> new NotFoundException("Paper not found: " + paperId));
        List<QuestionUnit> units = unitRepository.findByPaper(paperId);
        SubjectProfile profile = profiles.forSubject(paper.metadata().subjectCode());

        List<MarkSchemeEntry> entries = List.of();
        if (paper.markSchemeUri() != null) {
            PaperDocument markScheme = reader.read(artifactStore.get(paper.markSchemeUri()));
            entries = markSchemeParser.parse(markScheme, profile).entries();
        }
        LinkResult linked = linker.link(units, entries);
        transactionTemplate.executeWithoutResult(status -> linkRepository.replaceForPaper(paperId, linked.links()));
        log.info("Paper {} relinked: {} of {} units matched", paper.metadata().canonicalKey(),
                linked.links().stream().filter(MarkSchemeLink::matched).count(), units.size());
        return linked;
    }

    public List<Paper> papers() {
        return paperRepository.findAll();
    }

    private boolean hasMarkScheme(IngestionRequest request) {
        return request.markScheme() != null && request.markScheme().length > 0;
    }

    private record Persisted(Paper paper, List<QuestionUnit> units, int staleWorksheets) {}
}
