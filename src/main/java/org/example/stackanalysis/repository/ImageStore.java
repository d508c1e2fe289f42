package org.example.stackanalysis.repository;

import org.example.stackanalysis.model.ImageRef;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Remote image repository the analyses read from and attach results to.
 */
public interface ImageStore {

    /** Images of a dataset; empty when the dataset does not exist. */
    List<ImageRef> listImages(long datasetId);

    Optional<ImageRef> getImage(long imageId);

    ImageExport openExport(long imageId) throws IOException;

    /**
     * Links a file annotation to the image.
     *
     * @param namespace annotation namespace identifying the analysis that produced the file
     */
    void attach(long imageId, String filename, byte[] content, String namespace) throws IOException;

    /** E-mail address from the current user's profile, if any. */
    Optional<String> currentUserEmail();
}
