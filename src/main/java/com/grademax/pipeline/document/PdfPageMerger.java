package com.grademax.pipeline.document;

import com.grademax.pipeline.domain.DomainModels.Rect;
import com.grademax.pipeline.exception.WorksheetAssemblyException;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a new PDF from pages of existing ones. Page content streams and resources are carried
 * over as-is; a slice with a region only narrows the visible crop box.
 */
@Component
public class PdfPageMerger {
    private static final Logger log = LoggerFactory.getLogger(PdfPageMerger.class);

    public record PageSlice(String sourceKey, int pageIndex, Rect region) {}

    public byte[] merge(Map<String, byte[]> sources, List<PageSlice> slices) {
        Map<String, PDDocument> opened = new HashMap<>();
        List<PDDocument> toClose = new ArrayList<>();
        try (PDDocument target = new PDDocument()) {
            for (PageSlice slice : slices) {
                PDDocument source = opened.get(slice.sourceKey());
                if (source == null) {
                    byte[] bytes = sources.get(slice.sourceKey());
                    if (bytes == null) throw new WorksheetAssemblyException("Source document not loaded: " + slice.sourceKey());
                    source = PDDocument.load(new ByteArrayInputStream(bytes));
                    opened.put(slice.sourceKey(), source);
                    toClose.add(source);
                }
                if (slice.pageIndex() < 0 || slice.pageIndex() >= source.getNumberOfPages()) {
                    throw new WorksheetAssemblyException("Page " + slice.pageIndex() + " out of range for " + slice.sourceKey());
                }
                target.addPage(copyPage(source.getPage(slice.pageIndex()), slice.region()));
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            target.save(out);
            log.debug("Merged {} pages from {} sources", slices.size(), opened.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new WorksheetAssemblyException("Failed to merge pages: " + e.getMessage(), e);
        } finally {
            for (PDDocument doc : toClose) {
                try {
                    doc.close();
                } catch (IOException e) {
                    log.warn("Failed to close source document", e);
                }
            }
        }
    }

    /** The same source page may be used twice with different regions, so each use gets its own dictionary. */
    private PDPage copyPage(PDPage sourcePage, Rect region) {
        COSDictionary dictionary = new COSDictionary(sourcePage.getCOSObject());
        dictionary.removeItem(COSName.PARENT);
        PDPage page = new PDPage(dictionary);
        page.setResources(sourcePage.getResources());
        page.setMediaBox(sourcePage.getMediaBox());
        page.setRotation(sourcePage.getRotation());
        PDRectangle media = sourcePage.getMediaBox();
        if (region != null) {
            float lowerLeftY = (float) (media.getUpperRightY() - region.y() - region.height());
            page.setCropBox(new PDRectangle(
                    (float) (media.getLowerLeftX() + region.x()),
                    Math.max(media.getLowerLeftY(), lowerLeftY),
                    (float) region.width(),
                    (float) region.height()));
        } else {
            page.setCropBox(sourcePage.getCropBox());
        }
        return page;
    }
}
