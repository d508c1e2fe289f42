package org.example.stackanalysis.service.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.example.stackanalysis.model.ExportedImage;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.repository.ImageExport;
import org.example.stackanalysis.repository.ImageStore;
import org.example.stackanalysis.service.ByteCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the selected images out of the store as single OME-TIFF files.
 */
@Service
@RequiredArgsConstructor
public class ImageExporter {

    private static final Logger logger = LoggerFactory.getLogger(ImageExporter.class);

    @Value("${analysis.export.chunk-size:1000000}")
    private int chunkSize = 1_000_000;

    private final ImageStore imageStore;

    @PostConstruct
    void checkChunkSize() {
        if (chunkSize < 1) {
            throw new IllegalStateException("analysis.export.chunk-size must be at least 1, was " + chunkSize);
        }
    }

    /**
     * Exports each image to {@code <id>.ome.tif} in the workspace. Images that cannot be
     * exported are logged and left out; the others keep their selection order.
     */
    public List<ExportedImage> export(List<ImageRef> images, Workspace workspace) {
        List<ExportedImage> exported = new ArrayList<>();
        for (ImageRef img : images) {
            if (img == null) continue;
            Path target = workspace.newFile(img.getId() + ".ome.tif");
            try {
                long bytes = exportImage(img.getId(), target);
                logger.info("Exported image {} : {} ({})", img.getId(), img.getName(), ByteCounts.format(bytes));
                exported.add(new ExportedImage(img, target));
            } catch (IOException | RuntimeException e) {
                logger.error("Cannot export image {} : {}", img.getId(), img.getName(), e);
                workspace.delete(target);
            }
        }
        return exported;
    }

    private long exportImage(long imageId, Path target) throws IOException {
        long written = 0;
        try (ImageExport export = imageStore.openExport(imageId);
             OutputStream out = Files.newOutputStream(target)) {
            export.generate();
            while (true) {
                byte[] buf = export.read(written, chunkSize);
                out.write(buf);
                written += buf.length;
                if (buf.length < chunkSize) break;
            }
        }
        return written;
    }
}
