package com.grademax.pipeline.document;

import com.grademax.pipeline.document.DocumentModels.LocatedLine;
import com.grademax.pipeline.document.DocumentModels.PageText;
import com.grademax.pipeline.document.DocumentModels.PaperDocument;
import com.grademax.pipeline.document.DocumentModels.TextLine;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.DomainModels.Rect;

import java.util.ArrayList;
import java.util.List;

public final class PageRegions {
    public static final double PADDING = 10.0;

    private PageRegions() {
    }

    public static List<PageRange> of(PaperDocument document, List<LocatedLine> lines) {
        if (lines.isEmpty()) return List.of();
        int first = lines.get(0).page();
        int last = lines.get(lines.size() - 1).page();
        List<PageRange> ranges = new ArrayList<>();
        for (int page = first; page <= last; page++) {
            int p = page;
            List<TextLine> onPage = lines.stream().filter(l -> l.page() == p).map(LocatedLine::line).toList();
            ranges.add(new PageRange(page, onPage.isEmpty() ? null : bounds(document.page(page), onPage)));
        }
        return ranges;
    }

    private static Rect bounds(PageText page, List<TextLine> lines) {
        double minX = lines.stream().mapToDouble(TextLine::x).min().orElse(0);
        double minY = lines.stream().mapToDouble(TextLine::y).min().orElse(0);
        double maxX = lines.stream().mapToDouble(TextLine::right).max().orElse(page.width());
        double maxY = lines.stream().mapToDouble(TextLine::bottom).max().orElse(page.height());
        double x = Math.max(0, minX - PADDING);
        double y = Math.max(0, minY - PADDING);
        double right = Math.min(page.width(), maxX + PADDING);
        double bottom = Math.min(page.height(), maxY + PADDING);
        return new Rect(x, y, Math.max(0, right - x), Math.max(0, bottom - y));
    }
}
