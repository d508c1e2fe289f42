package org.example.stackanalysis.service.impl;

import org.example.stackanalysis.TestImages;
import org.example.stackanalysis.TestImages.ByteArrayExport;
import org.example.stackanalysis.model.ExportedImage;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.repository.ImageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ImageExporterTest {

    @TempDir
    Path parent;

    private ImageStore store;
    private ImageExporter exporter;
    private Workspace workspace;

    @BeforeEach
    void setUp() throws IOException {
        store = mock(ImageStore.class);
        exporter = new ImageExporter(store);
        ReflectionTestUtils.setField(exporter, "chunkSize", 4);
        workspace = Workspace.create(parent, "export");
    }

    @AfterEach
    void tearDown() {
        workspace.dispose();
    }

    @Test
    void copiesInChunksUntilShortRead() throws IOException {
        byte[] data = "0123456789".getBytes();
        ByteArrayExport export = new ByteArrayExport(data);
        when(store.openExport(7L)).thenReturn(export);

        List<ExportedImage> out = exporter.export(List.of(TestImages.image(7, "a.tif", null, null, "c1")), workspace);

        assertEquals(1, out.size());
        Path file = out.get(0).getLocalFile();
        assertEquals("7.ome.tif", file.getFileName().toString());
        assertEquals(workspace.path(), file.getParent());
        assertArrayEquals(data, Files.readAllBytes(file));
        assertEquals(List.of(0L, 4L, 8L), export.offsets);
        assertTrue(export.generated);
        assertTrue(export.closed);
    }

    @Test
    void exactMultipleOfChunkEndsOnEmptyRead() throws IOException {
        byte[] data = "01234567".getBytes();
        ByteArrayExport export = new ByteArrayExport(data);
        when(store.openExport(8L)).thenReturn(export);

        List<ExportedImage> out = exporter.export(List.of(TestImages.image(8, "b.tif", null, null, "c1")), workspace);

        assertArrayEquals(data, Files.readAllBytes(out.get(0).getLocalFile()));
        assertEquals(List.of(0L, 4L, 8L), export.offsets);
    }

    @Test
    void failedExportIsSkippedAndOrderKept() throws IOException {
        ImageRef a = TestImages.image(1, "a.tif", null, null, "c1");
        ImageRef b = TestImages.image(2, "b.tif", null, null, "c1");
        ImageRef c = TestImages.image(3, "c.tif", null, null, "c1");
        when(store.openExport(1L)).thenReturn(new ByteArrayExport(new byte[]{1}));
        when(store.openExport(2L)).thenThrow(new NoSuchFileException("2"));
        when(store.openExport(3L)).thenReturn(new ByteArrayExport(new byte[]{3}));

        List<ExportedImage> out = exporter.export(List.of(c, b, a), workspace);

        assertEquals(2, out.size());
        assertSame(c, out.get(0).getImage());
        assertSame(a, out.get(1).getImage());
        assertFalse(Files.exists(workspace.path().resolve("2.ome.tif")));
    }

    @Test
    void chunkSizeBelowOneIsRejected() {
        ReflectionTestUtils.setField(exporter, "chunkSize", 0);

        assertThrows(IllegalStateException.class, () -> exporter.checkChunkSize());
    }
}
