package com.grademax.pipeline;

import com.grademax.pipeline.domain.DomainModels.PaperMetadata;
import com.grademax.pipeline.service.IngestionModels.MetadataHints;
import com.grademax.pipeline.service.MetadataDetector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetadataDetectorTest {
    private final MetadataDetector detector = new MetadataDetector();

    @Test
    void readsEdexcelFileNames() {
        PaperMetadata metadata = detector.resolve("uploads/4PH1_1P_MS_Jun_2019.pdf", null);
        assertEquals("Edexcel/IGCSE/4PH1/2019/June/1P", metadata.canonicalKey());
    }

    @Test
    void readsCambridgeFileNames() {
        PaperMetadata metadata = detector.resolve("0625_w21_qp_42.pdf", null);
        assertEquals("Cambridge", metadata.board());
        assertEquals("0625", metadata.subjectCode());
        assertEquals(2021, metadata.year());
        assertEquals("Winter", metadata.season());
        assertEquals("42", metadata.paperNumber());
    }

    @Test
    void readsAqaFileNames() {
        PaperMetadata metadata = detector.resolve("8463-1H-QP-JUN19.pdf", null);
        assertEquals("AQA/GCSE/8463/2019/June/1H", metadata.canonicalKey());
    }

    @Test
    void callerHintsWinOverTheFileName() {
        MetadataHints hints = new MetadataHints(null, null, null, 2020, "November", "2P");
        PaperMetadata metadata = detector.resolve("4PH1_1P_Jun_2019.pdf", hints);
        assertEquals("Edexcel/IGCSE/4PH1/2020/November/2P", metadata.canonicalKey());
    }

    @Test
    void looseNamesNeedHintsForTheMissingFields() {
        MetadataHints detected = detector.detect("physics 4PH1 summer 2022.pdf");
        assertEquals("4PH1", detected.subjectCode());
        assertEquals(2022, detected.year());
        assertEquals("Summer", detected.season());
        assertNull(detected.paperNumber());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> detector.resolve("physics 4PH1 summer 2022.pdf", null));
        assertTrue(error.getMessage().contains("paperNumber"));

        PaperMetadata metadata = detector.resolve("physics 4PH1 summer 2022.pdf",
                new MetadataHints(null, null, null, null, null, "1P"));
        assertEquals("Unknown", metadata.board());
        assertEquals("1P", metadata.paperNumber());
    }
}
