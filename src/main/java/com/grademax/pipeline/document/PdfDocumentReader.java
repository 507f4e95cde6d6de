package com.grademax.pipeline.document;

import com.grademax.pipeline.document.DocumentModels.PageText;
import com.grademax.pipeline.document.DocumentModels.PaperDocument;
import com.grademax.pipeline.document.DocumentModels.TextLine;
import com.grademax.pipeline.exception.DocumentReadException;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

@Component
public class PdfDocumentReader {
    private static final Logger log = LoggerFactory.getLogger(PdfDocumentReader.class);

    public PaperDocument read(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DocumentReadException("Document is empty", null);
        }
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(bytes))) {
            LineCollector collector = new LineCollector();
            List<PageText> pages = new ArrayList<>();
            for (int i = 0; i < document.getNumberOfPages(); i++) {
                PDPage page = document.getPage(i);
                collector.setStartPage(i + 1);
                collector.setEndPage(i + 1);
                collector.writeText(document, new StringWriter());
                PDRectangle box = page.getCropBox();
                pages.add(new PageText(i, box.getWidth(), box.getHeight(), hasImage(page), collector.drain()));
            }
            log.debug("Read PDF: {} bytes -> {} pages", bytes.length, pages.size());
            return new PaperDocument(List.copyOf(pages));
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read PDF document: " + e.getMessage(), e);
        }
    }

    public int pageCount(byte[] bytes) {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(bytes))) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read PDF document: " + e.getMessage(), e);
        }
    }

    private boolean hasImage(PDPage page) throws IOException {
        PDResources resources = page.getResources();
        if (resources == null) return false;
        for (COSName name : resources.getXObjectNames()) {
            if (resources.isImageXObject(name)) return true;
        }
        return false;
    }

    private static final class LineCollector extends PDFTextStripper {
        private final List<TextLine> lines = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private double minX, minY, maxX, maxY;
        private boolean open;

        LineCollector() throws IOException {
            setSortByPosition(true);
        }

        @Override
        protected void startPage(PDPage page) {
            lines.clear();
            text.setLength(0);
            open = false;
        }

        @Override
        protected void writeString(String string, List<TextPosition> textPositions) {
            for (TextPosition p : textPositions) {
                double x = p.getXDirAdj();
                double top = p.getYDirAdj() - p.getHeightDir();
                double right = x + p.getWidthDirAdj();
                double bottom = p.getYDirAdj();
                if (!open) {
                    minX = x;
                    minY = top;
                    maxX = right;
                    maxY = bottom;
                    open = true;
                } else {
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, top);
                    maxX = Math.max(maxX, right);
                    maxY = Math.max(maxY, bottom);
                }
            }
            text.append(string);
        }

        @Override
        protected void writeWordSeparator() {
            text.append(' ');
        }

        @Override
        protected void writeLineSeparator() {
            flushLine();
        }

        @Override
        protected void endPage(PDPage page) {
            flushLine();
        }

        private void flushLine() {
            String line = text.toString().replaceAll("\\s+", " ").trim();
            if (open && !line.isEmpty()) {
                lines.add(new TextLine(line, minX, minY, maxX - minX, maxY - minY));
            }
            text.setLength(0);
            open = false;
        }

        List<TextLine> drain() {
            List<TextLine> result = List.copyOf(lines);
            lines.clear();
            return result;
        }
    }
}
