package com.grademax.pipeline;

import com.grademax.pipeline.config.PipelineProperties;
import com.grademax.pipeline.exception.ArtifactStoreException;
import com.grademax.pipeline.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {
    @TempDir
    Path dir;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(new PipelineProperties(null,
                new PipelineProperties.Storage(dir.resolve("store").toString()), null, null));
    }

    @Test
    void sameBytesGiveSameUri() {
        byte[] bytes = "%PDF-1.4 worksheet".getBytes(StandardCharsets.US_ASCII);
        String first = store.put("worksheets", bytes);
        String second = store.put("worksheets", bytes.clone());

        assertEquals(first, second);
        assertTrue(first.startsWith("file:"));
        assertTrue(first.endsWith(ArtifactStore.sha256(bytes) + ".pdf"));
        assertArrayEquals(bytes, store.get(first));
        assertTrue(store.exists(first));
        assertNotEquals(first, store.put("answers", bytes));
    }

    @Test
    void refusesUrisOutsideTheStore() throws Exception {
        Path outside = Files.writeString(dir.resolve("outside.pdf"), "x");
        assertThrows(ArtifactStoreException.class, () -> store.get(outside.toUri().toString()));
        assertFalse(store.exists(null));
    }
}
