package com.grademax.pipeline.service;

import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.DomainModels.Paper;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;

import java.util.List;

public class IngestionModels {
    public record MetadataHints(String board, String level, String subjectCode, Integer year, String season, String paperNumber) {
        public static MetadataHints none() {
            return new MetadataHints(null, null, null, null, null, null);
        }
    }

    public record IngestionRequest(String questionPaperName,
                                   byte[] questionPaper,
                                   String markSchemeName,
                                   byte[] markScheme,
                                   MetadataHints hints) {
        public IngestionRequest {
            if (hints == null) hints = MetadataHints.none();
        }
    }

    public enum Status { OK, FAILED }

    public record PaperResult(Paper paper,
                              List<QuestionUnit> units,
                              List<MarkSchemeLink> links,
                              List<PipelineIssue> issues,
                              Status status,
                              int staleWorksheets) {
        public static PaperResult failed(List<PipelineIssue> issues) {
            return new PaperResult(null, List.of(), List.of(), List.copyOf(issues), Status.FAILED, 0);
        }
    }

    public record UnitArtifacts(QuestionUnit unit,
                                String paperKey,
                                String questionPaperUri,
                                List<PageRange> pageRanges,
                                String markSchemeUri,
                                MarkSchemeLink link) {}
}
