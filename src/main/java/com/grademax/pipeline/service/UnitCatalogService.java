package com.grademax.pipeline.service;

import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.Paper;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.NotFoundException;
import com.grademax.pipeline.repository.MarkSchemeLinkJdbcRepository;
import com.grademax.pipeline.repository.PaperJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository.StoredUnit;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository.UnitQuery;
import com.grademax.pipeline.service.IngestionModels.UnitArtifacts;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
public class UnitCatalogService {
    private final QuestionUnitJdbcRepository unitRepository;
    private final MarkSchemeLinkJdbcRepository linkRepository;
    private final PaperJdbcRepository paperRepository;

    public UnitCatalogService(QuestionUnitJdbcRepository unitRepository,
                              MarkSchemeLinkJdbcRepository linkRepository,
                              PaperJdbcRepository paperRepository) {
        this.unitRepository = unitRepository;
        this.linkRepository = linkRepository;
        this.paperRepository = paperRepository;
    }

    public List<StoredUnit> find(Set<String> topicCodes, Integer yearFrom, Integer yearTo, Difficulty difficulty,
                                 String subjectCode, boolean wholeQuestionsOnly) {
        if (yearFrom != null && yearTo != null && yearFrom > yearTo) {
            throw new IllegalArgumentException("yearFrom must not be after yearTo");
        }
        return unitRepository.query(new UnitQuery(topicCodes == null ? Set.of() : topicCodes, yearFrom, yearTo,
                difficulty, subjectCode, wholeQuestionsOnly));
    }

    public List<QuestionUnit> unitsOfPaper(String paperId) {
        paperRepository.findById(paperId).orElseThrow(() -> new NotFoundException("Paper not found: " + paperId));
        return unitRepository.findByPaper(paperId);
    }

    public UnitArtifacts artifacts(String unitId) {
        QuestionUnit unit = unitRepository.findById(unitId)
                .orElseThrow(() -> new NotFoundException("Question unit not found: " + unitId));
        Paper paper = paperRepository.findById(unit.getPaperId())
                .orElseThrow(() -> new NotFoundException("Paper not found: " + unit.getPaperId()));
        MarkSchemeLink link = linkRepository.findByUnit(unitId).orElse(null);
        return new UnitArtifacts(unit, paper.metadata().canonicalKey(), paper.questionPaperUri(), unit.getPageRanges(),
                paper.markSchemeUri(), link);
    }
}
