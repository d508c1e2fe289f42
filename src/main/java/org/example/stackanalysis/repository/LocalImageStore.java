package org.example.stackanalysis.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.stackanalysis.model.ImageRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Image store backed by a directory holding a {@code catalog.json}:
 *
 * <pre>
 * {
 *   "userEmail": "someone@example.org",
 *   "datasets": [
 *     { "id": 1, "name": "D1", "project": "P1",
 *       "images": [ { "id": 42, "name": "a.tif", "file": "images/42.ome.tif",
 *                     "sizeX": 512, "sizeY": 512, "sizeC": 2, "sizeZ": 1, "sizeT": 1,
 *                     "channels": ["c1", "c2"], "pixelType": "uint16" } ] }
 *   ]
 * }
 * </pre>
 *
 * Attachments are written to {@code attachments/<imageId>/<filename>} below the root.
 */
@Repository
public class LocalImageStore implements ImageStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalImageStore.class);

    static final String CATALOG = "catalog.json";
    static final String ATTACHMENTS = "attachments";

    @Value("${analysis.store.root}")
    private String storeRoot;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path root() {
        return Paths.get(storeRoot).toAbsolutePath().normalize();
    }

    private JsonNode catalog() {
        Path p = root().resolve(CATALOG);
        if (!Files.exists(p)) {
            logger.warn("No catalog found at {}", p);
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(p.toFile());
        } catch (IOException e) {
            logger.error("Cannot read catalog {}", p, e);
            return mapper.createObjectNode();
        }
    }

    @Override
    public List<ImageRef> listImages(long datasetId) {
        List<ImageRef> images = new ArrayList<>();
        for (JsonNode ds : catalog().path("datasets")) {
            if (ds.path("id").asLong(-1) == datasetId) {
                for (JsonNode img : ds.path("images")) {
                    images.add(toImageRef(ds, img));
                }
            }
        }
        return images;
    }

    @Override
    public Optional<ImageRef> getImage(long imageId) {
        return findImageNode(catalog(), imageId).map(pair -> toImageRef(pair[0], pair[1]));
    }

    @Override
    public ImageExport openExport(long imageId) throws IOException {
        JsonNode img = findImageNode(catalog(), imageId)
                .map(pair -> pair[1])
                .orElseThrow(() -> new NoSuchFileException("image " + imageId + " not in catalog"));
        Path file = root().resolve(img.path("file").asText("")).normalize();
        if (!file.startsWith(root()) || !Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return new FileExport(file);
    }

    @Override
    public void attach(long imageId, String filename, byte[] content, String namespace) throws IOException {
        Path dir = root().resolve(ATTACHMENTS).resolve(String.valueOf(imageId));
        Files.createDirectories(dir);
        Path target = dir.resolve(Paths.get(filename).getFileName().toString());
        Files.write(target, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        logger.info("Attached {} to image {} (ns={})", target.getFileName(), imageId, namespace);
    }

    @Override
    public Optional<String> currentUserEmail() {
        String email = catalog().path("userEmail").asText("");
        return email.isBlank() ? Optional.empty() : Optional.of(email);
    }

    private static Optional<JsonNode[]> findImageNode(JsonNode catalog, long imageId) {
        for (JsonNode ds : catalog.path("datasets")) {
            for (JsonNode img : ds.path("images")) {
                if (img.path("id").asLong(-1) == imageId) {
                    return Optional.of(new JsonNode[]{ds, img});
                }
            }
        }
        return Optional.empty();
    }

    private static ImageRef toImageRef(JsonNode ds, JsonNode img) {
        ImageRef.ImageRefBuilder b = ImageRef.builder()
                .id(img.path("id").asLong())
                .name(img.path("name").asText(null))
                .datasetName(ds.path("name").asText(null))
                .projectName(ds.path("project").asText(null))
                .sizeX(img.path("sizeX").asInt(0))
                .sizeY(img.path("sizeY").asInt(0))
                .sizeC(img.path("sizeC").asInt(1))
                .sizeZ(img.path("sizeZ").asInt(1))
                .sizeT(img.path("sizeT").asInt(1))
                .pixelType(img.path("pixelType").asText(null));
        for (JsonNode ch : img.path("channels")) {
            b.channelName(ch.asText());
        }
        return b.build();
    }

    /** Reads the catalogued file directly; the file already is the single-file export. */
    private static class FileExport implements ImageExport {
        private final Path file;
        private InputStream in;
        private long position;

        FileExport(Path file) {
            this.file = file;
        }

        @Override
        public long generate() throws IOException {
            in = Files.newInputStream(file);
            position = 0;
            return Files.size(file);
        }

        @Override
        public byte[] read(long offset, int length) throws IOException {
            if (in == null) throw new IllegalStateException("export not generated");
            if (offset != position) {
                in.close();
                in = Files.newInputStream(file);
                in.skipNBytes(offset);
                position = offset;
            }
            byte[] buf = in.readNBytes(length);
            position += buf.length;
            return buf;
        }

        @Override
        public void close() throws IOException {
            if (in != null) in.close();
        }
    }
}
