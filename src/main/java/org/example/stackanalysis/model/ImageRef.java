package org.example.stackanalysis.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Snapshot of a stored image taken once at the start of a run.
 */
@Getter
@Builder
@ToString
public class ImageRef {
    private final long id;
    private final String name;
    private final String datasetName;
    private final String projectName;

    private final int sizeX;
    private final int sizeY;
    private final int sizeC;
    private final int sizeZ;
    private final int sizeT;

    @Singular
    private final List<String> channelNames;
    private final String pixelType;

    /**
     * Zero-based index of the channel named by the selector, or -1.
     * An exact name match wins over the 1-based positional reading.
     */
    public int findChannelIndex(String selector) {
        if (selector == null) return -1;
        for (int i = 0; i < channelNames.size(); i++) {
            if (selector.equals(channelNames.get(i))) return i;
        }
        for (int i = 0; i < channelNames.size(); i++) {
            if (selector.equals(String.valueOf(i + 1))) return i;
        }
        return -1;
    }

    public String getBaseName() {
        if (name == null) return "-";
        String n = name.replace('\\', '/');
        int i = n.lastIndexOf('/');
        return i >= 0 ? n.substring(i + 1) : n;
    }
}
