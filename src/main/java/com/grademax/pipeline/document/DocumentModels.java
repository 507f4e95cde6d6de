package com.grademax.pipeline.document;

import java.util.ArrayList;
import java.util.List;

public class DocumentModels {
    /** One visual line of text; x/y is the top-left corner in PDF points with origin at the page's top-left. */
    public record TextLine(String text, double x, double y, double width, double height) {
        public double bottom() {
            return y + height;
        }

        public double right() {
            return x + width;
        }
    }

    public record LocatedLine(int page, TextLine line) {
        public String text() {
            return line.text();
        }
    }

    public record PageText(int index, double width, double height, boolean hasImage, List<TextLine> lines) {}

    public record PaperDocument(List<PageText> pages) {
        public int pageCount() {
            return pages.size();
        }

        public PageText page(int index) {
            return pages.get(index);
        }

        public List<LocatedLine> lines() {
            List<LocatedLine> all = new ArrayList<>();
            pages.forEach(p -> p.lines().forEach(l -> all.add(new LocatedLine(p.index(), l))));
            return all;
        }
    }
}
