package com.grademax.pipeline.assembly;

import com.grademax.pipeline.assembly.WorksheetModels.AssemblyResult;
import com.grademax.pipeline.assembly.WorksheetModels.Worksheet;
import com.grademax.pipeline.assembly.WorksheetModels.WorksheetCriteria;
import com.grademax.pipeline.document.PdfPageMerger;
import com.grademax.pipeline.document.PdfPageMerger.PageSlice;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.NotFoundException;
import com.grademax.pipeline.repository.MarkSchemeLinkJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository.StoredUnit;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository.UnitQuery;
import com.grademax.pipeline.repository.WorksheetJdbcRepository;
import com.grademax.pipeline.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;

@Service
public class WorksheetAssembler {
    private static final Logger log = LoggerFactory.getLogger(WorksheetAssembler.class);
    static final double MINUTES_PER_MARK = 1.5;

    private final QuestionUnitJdbcRepository unitRepository;
    private final MarkSchemeLinkJdbcRepository linkRepository;
    private final WorksheetJdbcRepository worksheetRepository;
    private final ArtifactStore artifactStore;
    private final PdfPageMerger merger;
    private final TransactionTemplate transactionTemplate;

    public WorksheetAssembler(QuestionUnitJdbcRepository unitRepository,
                              MarkSchemeLinkJdbcRepository linkRepository,
                              WorksheetJdbcRepository worksheetRepository,
                              ArtifactStore artifactStore,
                              PdfPageMerger merger,
                              TransactionTemplate transactionTemplate) {
        this.unitRepository = unitRepository;
        this.linkRepository = linkRepository;
        this.worksheetRepository = worksheetRepository;
        this.artifactStore = artifactStore;
        this.merger = merger;
        this.transactionTemplate = transactionTemplate;
    }

    public AssemblyResult assemble(WorksheetCriteria criteria) {
        if (criteria == null) throw new IllegalArgumentException("criteria are required");
        List<String> problems = criteria.problems();
        if (!problems.isEmpty()) throw new IllegalArgumentException(String.join("; ", problems));
        return build(UUID.randomUUID().toString(), criteria);
    }

    public AssemblyResult regenerate(String worksheetId) {
        Worksheet existing = findById(worksheetId);
        return build(existing.id(), existing.criteria());
    }

    public Worksheet findById(String worksheetId) {
        return worksheetRepository.findById(worksheetId)
                .orElseThrow(() -> new NotFoundException("Worksheet not found: " + worksheetId));
    }

    private AssemblyResult build(String worksheetId, WorksheetCriteria criteria) {
        List<StoredUnit> selection = select(criteria);
        List<QuestionUnit> units = selection.stream().map(StoredUnit::unit).toList();
        List<String> unitIds = units.stream().map(QuestionUnit::getId).toList();
        Set<String> paperIds = new LinkedHashSet<>();
        selection.forEach(s -> paperIds.add(s.unit().getPaperId()));

        int totalMarks = units.stream().mapToInt(u -> u.getMarkValue() == null ? 0 : u.getMarkValue()).sum();
        int minutes = (int) Math.ceil(totalMarks * MINUTES_PER_MARK);

        if (selection.isEmpty()) {
            log.info("Worksheet {} matched no units; no documents written", worksheetId);
            Worksheet worksheet = new Worksheet(worksheetId, criteria, List.of(), null, null, 0, 0, Instant.now(), false);
            save(worksheet, List.of());
            return new AssemblyResult(worksheet, List.of(), 0, 0);
        }

        Map<String, byte[]> sources = new HashMap<>();
        List<PageSlice> questionSlices = new ArrayList<>();
        List<PageSlice> answerSlices = new ArrayList<>();
        Map<String, MarkSchemeLink> links = linkRepository.findByUnits(unitIds);

        for (StoredUnit stored : selection) {
            load(sources, stored.questionPaperUri());
            for (PageRange range : stored.unit().getPageRanges()) {
                questionSlices.add(new PageSlice(stored.questionPaperUri(), range.pageIndex(), range.region()));
            }
            MarkSchemeLink link = links.get(stored.unit().getId());
            if (link == null || !link.matched() || stored.markSchemeUri() == null) continue;
            load(sources, stored.markSchemeUri());
            for (PageRange range : link.markSchemePages()) {
                answerSlices.add(new PageSlice(stored.markSchemeUri(), range.pageIndex(), range.region()));
            }
        }

        String worksheetUri = artifactStore.put("worksheets", merger.merge(sources, questionSlices));
        String answerPackUri = answerSlices.isEmpty() ? null : artifactStore.put("answers", merger.merge(sources, answerSlices));

        Worksheet worksheet = new Worksheet(worksheetId, criteria, unitIds, worksheetUri, answerPackUri, totalMarks, minutes, Instant.now(), false);
        save(worksheet, paperIds);
        log.info("Worksheet {} assembled: {} units from {} papers, {} marks, {} question pages, {} answer pages",
                worksheetId, units.size(), paperIds.size(), totalMarks, questionSlices.size(), answerSlices.size());
        return new AssemblyResult(worksheet, units, questionSlices.size(), answerSlices.size());
    }

    private void save(Worksheet worksheet, Collection<String> paperIds) {
        transactionTemplate.executeWithoutResult(status -> worksheetRepository.save(worksheet, paperIds));
    }

    private List<StoredUnit> select(WorksheetCriteria criteria) {
        List<StoredUnit> selection = new ArrayList<>(unitRepository.query(new UnitQuery(criteria.topicCodes(),
                criteria.yearFrom(), criteria.yearTo(), criteria.difficulty(), criteria.subjectCode(),
                criteria.wholeQuestionsOnly())));
        if (criteria.shuffle()) {
            Collections.shuffle(selection, criteria.seed() == null ? new Random() : new Random(criteria.seed()));
        }
        return selection.size() > criteria.maxCount() ? selection.subList(0, criteria.maxCount()) : selection;
    }

    private void load(Map<String, byte[]> sources, String uri) {
        if (!sources.containsKey(uri)) sources.put(uri, artifactStore.get(uri));
    }
}
