package org.example.stackanalysis.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw text the analysis tool printed for one image: the line that opened the
 * block followed by one row per frame (or frame and channel pair).
 */
@Getter
public class ResultBlock {
    private final long imageId;
    private final String headerLine;
    private final List<String> rows;

    public ResultBlock(long imageId, String headerLine, List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Result block for image " + imageId + " has no rows");
        }
        this.imageId = imageId;
        this.headerLine = headerLine;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String toText() {
        StringBuilder sb = new StringBuilder(headerLine).append('\n');
        for (String row : rows) {
            sb.append(row).append('\n');
        }
        return sb.toString();
    }
}
