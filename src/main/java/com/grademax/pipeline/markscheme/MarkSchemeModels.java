package com.grademax.pipeline.markscheme;

import com.grademax.pipeline.domain.DomainModels.MarkPoint;
import com.grademax.pipeline.domain.DomainModels.PageRange;

import java.util.List;

public class MarkSchemeModels {
    public enum Layout { TABULAR, INDENTED, INLINE }

    public record MarkSchemeEntry(String questionNumber,
                                  String partCode,
                                  Integer marks,
                                  List<MarkPoint> markPoints,
                                  String rawText,
                                  List<PageRange> pageRanges) {
        public String key() {
            return questionNumber + partCode;
        }
    }

    public record MarkSchemeParse(List<MarkSchemeEntry> entries, Layout layout) {
        public static MarkSchemeParse empty() {
            return new MarkSchemeParse(List.of(), Layout.TABULAR);
        }
    }
}
