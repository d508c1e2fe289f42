package org.example.stackanalysis.repository;

import java.io.Closeable;
import java.io.IOException;

/**
 * Server side single-file (OME-TIFF) export of one image, read back in chunks.
 */
public interface ImageExport extends Closeable {

    /**
     * Prepares the export.
     *
     * @return the total length of the exported file in bytes
     */
    long generate() throws IOException;

    /**
     * Reads up to {@code length} bytes starting at {@code offset}. A short (or empty)
     * array means the end of the export was reached.
     */
    byte[] read(long offset, int length) throws IOException;
}
